package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringTokenizer;

/**
 * Reads graphs stored one vertex per line: {@code id neighbour*}. Lines
 * starting with {@code #} are comments. Labels come from an optional second
 * file with one {@code id label} pair per line.
 */
public class EdgeListGraphReader {
   private static final Logger LOG = Logger.getLogger(EdgeListGraphReader.class);

   public LabeledGraph read(Path graphPath) throws IOException {
      return read(graphPath, null);
   }

   public LabeledGraph read(Path graphPath, Path labelsPath) throws IOException {
      MainGraph graph;
      try (InputStream is = Files.newInputStream(graphPath)) {
         graph = readGraph(is);
      }

      IntIntMap labels = null;
      if (labelsPath != null) {
         try (InputStream is = Files.newInputStream(labelsPath)) {
            labels = readLabels(is);
         }
      }

      LOG.info("Read " + graphPath + ": numVertices=" + graph.numVertices() +
              " numEdges=" + graph.numEdges() +
              (labels != null ? " labels=" + labelsPath : ""));

      return new LabeledGraph(graph, labels);
   }

   public MainGraph readGraph(InputStream is) throws IOException {
      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      BufferedReader reader = newReader(is);

      String line = reader.readLine();
      int lineNumber = 1;
      while (line != null) {
         if (!isSkipped(line)) {
            StringTokenizer tokenizer = new StringTokenizer(line);
            int vertexId = parseId(tokenizer.nextToken(), lineNumber);
            builder.addVertex(vertexId);
            while (tokenizer.hasMoreTokens()) {
               int neighbour = parseId(tokenizer.nextToken(), lineNumber);
               if (neighbour == vertexId) {
                  throw new IOException("Self-loop on vertex " + vertexId +
                          " at line " + lineNumber);
               }
               builder.addEdge(vertexId, neighbour);
            }
         }
         line = reader.readLine();
         ++lineNumber;
      }

      return builder.build();
   }

   public IntIntMap readLabels(InputStream is) throws IOException {
      IntIntMap labels = HashIntIntMaps.newMutableMap();
      BufferedReader reader = newReader(is);

      String line = reader.readLine();
      int lineNumber = 1;
      while (line != null) {
         if (!isSkipped(line)) {
            StringTokenizer tokenizer = new StringTokenizer(line);
            if (tokenizer.countTokens() != 2) {
               throw new IOException("Expected 'id label' at line " + lineNumber);
            }
            int vertexId = parseId(tokenizer.nextToken(), lineNumber);
            int label = parseInt(tokenizer.nextToken(), lineNumber);
            labels.put(vertexId, label);
         }
         line = reader.readLine();
         ++lineNumber;
      }

      return labels;
   }

   private static BufferedReader newReader(InputStream is) {
      return new BufferedReader(new InputStreamReader(new BOMInputStream(is),
              StandardCharsets.UTF_8));
   }

   private static boolean isSkipped(String line) {
      return StringUtils.isBlank(line) || line.trim().startsWith("#");
   }

   private static int parseId(String token, int lineNumber) throws IOException {
      int value = parseInt(token, lineNumber);
      if (value < 0) {
         throw new IOException("Negative vertex id " + value + " at line " + lineNumber);
      }
      return value;
   }

   private static int parseInt(String token, int lineNumber) throws IOException {
      try {
         return Integer.parseInt(token);
      } catch (NumberFormatException e) {
         throw new IOException("Invalid integer '" + token + "' at line " +
                 lineNumber, e);
      }
   }
}
