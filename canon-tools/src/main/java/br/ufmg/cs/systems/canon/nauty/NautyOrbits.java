package br.ufmg.cs.systems.canon.nauty;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Automorphism group summary reported by dreadnaut: the number of orbits,
 * the number of generators and the orbits themselves as lists of vertices.
 */
public class NautyOrbits {
   private static final Pattern NUM_ORBITS = Pattern.compile("(\\d+) orbits?;");
   private static final Pattern NUM_GENERATORS = Pattern.compile("(\\d+) gens?;");
   private static final Pattern ORBIT_SIZE = Pattern.compile("\\(\\d+\\)");

   private final int numOrbits;
   private final int numGenerators;
   private final List<int[]> orbits;

   public NautyOrbits(int numOrbits, int numGenerators, List<int[]> orbits) {
      this.numOrbits = numOrbits;
      this.numGenerators = numGenerators;
      this.orbits = Collections.unmodifiableList(orbits);
   }

   public int getNumOrbits() {
      return numOrbits;
   }

   public int getNumGenerators() {
      return numGenerators;
   }

   public List<int[]> getOrbits() {
      return orbits;
   }

   /**
    * Parses the output of a dreadnaut session run with {@code -a -m} and
    * ending in {@code x o}: a report line with orbit and generator counts, a
    * cpu time line, then the orbits separated by {@code ;}, possibly spread
    * over indented continuation lines.
    */
   public static NautyOrbits parse(String output) throws NautyException {
      String[] lines = output.split("\\r?\\n");

      int reportLine = -1;
      Matcher orbitsMatcher = null;
      for (int i = 0; i < lines.length; ++i) {
         Matcher matcher = NUM_ORBITS.matcher(lines[i]);
         if (matcher.find()) {
            reportLine = i;
            orbitsMatcher = matcher;
            break;
         }
      }
      if (reportLine < 0) {
         throw new NautyException("No orbit report in dreadnaut output:\n" + output);
      }

      int numOrbits = Integer.parseInt(orbitsMatcher.group(1));
      Matcher generatorsMatcher = NUM_GENERATORS.matcher(lines[reportLine]);
      int numGenerators = generatorsMatcher.find() ?
              Integer.parseInt(generatorsMatcher.group(1)) : 0;

      int orbitsStart = reportLine + 1;
      while (orbitsStart < lines.length && lines[orbitsStart].contains("cpu time")) {
         ++orbitsStart;
      }

      StringBuilder orbitsText = new StringBuilder();
      for (int i = orbitsStart; i < lines.length; ++i) {
         if (i > orbitsStart && !isContinuation(lines[i])) {
            break;
         }
         orbitsText.append(' ').append(lines[i].trim());
      }

      List<int[]> orbits = parseOrbits(orbitsText.toString());
      if (orbits.size() != numOrbits) {
         throw new NautyException("Expected " + numOrbits + " orbits, parsed " +
                 orbits.size() + " from '" + orbitsText.toString().trim() + "'");
      }

      return new NautyOrbits(numOrbits, numGenerators, orbits);
   }

   private static boolean isContinuation(String line) {
      return !line.isEmpty() && Character.isWhitespace(line.charAt(0)) &&
              StringUtils.isNotBlank(line);
   }

   /**
    * Orbits such as {@code 0 2:4 (4); 1;}: vertices, ranges {@code a:b} and
    * an optional orbit size in parentheses.
    */
   static List<int[]> parseOrbits(String text) throws NautyException {
      List<int[]> orbits = new ArrayList<>();
      for (String chunk : text.split(";")) {
         String orbitText = ORBIT_SIZE.matcher(chunk).replaceAll(" ").trim();
         if (StringUtils.isBlank(orbitText)) {
            continue;
         }

         List<Integer> vertices = new ArrayList<>();
         for (String element : orbitText.split("\\s+")) {
            try {
               int colon = element.indexOf(':');
               if (colon >= 0) {
                  int from = Integer.parseInt(element.substring(0, colon));
                  int to = Integer.parseInt(element.substring(colon + 1));
                  for (int v = from; v <= to; ++v) {
                     vertices.add(v);
                  }
               } else {
                  vertices.add(Integer.parseInt(element));
               }
            } catch (NumberFormatException e) {
               throw new NautyException("Invalid orbit element '" + element + "'", e);
            }
         }

         int[] orbit = new int[vertices.size()];
         for (int i = 0; i < orbit.length; ++i) {
            orbit[i] = vertices.get(i);
         }
         orbits.add(orbit);
      }
      return orbits;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("NautyOrbits{numOrbits=").append(numOrbits)
              .append(", numGenerators=").append(numGenerators)
              .append(", orbits=[");
      for (int i = 0; i < orbits.size(); ++i) {
         if (i > 0) sb.append(", ");
         sb.append(Arrays.toString(orbits.get(i)));
      }
      return sb.append("]}").toString();
   }
}
