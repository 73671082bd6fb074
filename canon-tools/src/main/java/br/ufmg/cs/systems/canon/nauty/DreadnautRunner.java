package br.ufmg.cs.systems.canon.nauty;

import br.ufmg.cs.systems.canon.conf.Configuration;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.io.GraphNormalizer;
import br.ufmg.cs.systems.canon.io.NormalizedGraph;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import com.koloboke.collect.map.IntIntMap;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes automorphism orbits by running nauty's {@code dreadnaut} on a
 * generated command file.
 */
public class DreadnautRunner {
   private static final Logger LOG = Logger.getLogger(DreadnautRunner.class);
   private static final int MAX_MESSAGE_OUTPUT = 500;

   private final String dreadnaut;
   private final File tmpDir;

   public DreadnautRunner(Configuration configuration) {
      this(configuration.getDreadnautCommand(),
              new File(configuration.getNautyTmpDir()));
   }

   public DreadnautRunner(String dreadnaut, File tmpDir) {
      this.dreadnaut = dreadnaut;
      this.tmpDir = tmpDir;
   }

   /**
    * Orbits of {@code graph}, with vertices given by their original ids.
    * Labels become the initial partition, so only vertices with equal labels
    * can share an orbit.
    */
   public NautyOrbits orbits(MainGraph graph, @Nullable IntIntMap labels)
           throws NautyException {
      NormalizedGraph normalized = GraphNormalizer.normalize(graph, labels);
      List<String> commands = commandFile(normalized.getGraph(),
              normalized.getLabels());
      NautyOrbits denseOrbits = NautyOrbits.parse(run(commands));

      List<int[]> orbits = new ArrayList<>(denseOrbits.getOrbits().size());
      for (int[] orbit : denseOrbits.getOrbits()) {
         orbits.add(normalized.toOriginal(orbit));
      }
      return new NautyOrbits(denseOrbits.getNumOrbits(),
              denseOrbits.getNumGenerators(), orbits);
   }

   /**
    * dreadnaut session for a graph with ids {@code 0..n-1}: sparse mode, no
    * automorphism or level output, the graph in adjacency form with each edge
    * listed once, an optional partition by label, then canonical labeling and
    * orbit output.
    */
   public static List<String> commandFile(MainGraph graph, @Nullable IntIntMap labels) {
      List<String> lines = new ArrayList<>();
      lines.add("As");
      lines.add("-a");
      lines.add("-m");
      lines.add("n=" + graph.numVertices() + " g");

      for (int u = 0; u < graph.numVertices(); ++u) {
         StringBuilder line = new StringBuilder();
         line.append(' ').append(graph.vertexId(u)).append(" : ");
         for (int v : graph.neighborhoodVertices(u)) {
            if (u < v) {
               line.append(graph.vertexId(v)).append(' ');
            }
         }
         line.append(';');
         lines.add(line.toString());
      }

      if (labels != null && graph.numVertices() > 0) {
         lines.add(partition(graph, labels));
      }

      lines.add(".");
      lines.add("+c");
      lines.add("x");
      lines.add("o");
      return lines;
   }

   private static String partition(MainGraph graph, IntIntMap labels) {
      int numVertices = graph.numVertices();
      int[] order = PrimitiveArrays.identity(numVertices);
      PrimitiveArrays.sort(order, (a, b) -> {
         int labelA = labels.get(graph.vertexId(a));
         int labelB = labels.get(graph.vertexId(b));
         return labelA != labelB ? Integer.compare(labelA, labelB) :
                 Integer.compare(a, b);
      });

      StringBuilder line = new StringBuilder("f=[");
      int prevLabel = labels.get(graph.vertexId(order[0]));
      for (int pos : order) {
         int label = labels.get(graph.vertexId(pos));
         if (label != prevLabel) {
            line.append('|');
            prevLabel = label;
         }
         line.append(' ').append(graph.vertexId(pos)).append(' ');
      }
      return line.append(']').toString();
   }

   private String run(List<String> commands) throws NautyException {
      File commandFile = null;
      Process process = null;
      try {
         commandFile = File.createTempFile("dreadnaut", ".txt", tmpDir);
         FileUtils.writeLines(commandFile, StandardCharsets.UTF_8.name(), commands);

         // diagnostics end up in the output and in failure messages
         ProcessBuilder builder = new ProcessBuilder(dreadnaut);
         builder.redirectErrorStream(true);
         process = builder.start();

         try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(("< " + commandFile.getAbsolutePath() + "\n")
                    .getBytes(StandardCharsets.UTF_8));
         }

         String output = IOUtils.toString(process.getInputStream(),
                 StandardCharsets.UTF_8);
         int exitCode = process.waitFor();
         if (exitCode != 0) {
            throw new NautyException(dreadnaut + " exited with code " + exitCode +
                    ": " + StringUtils.abbreviate(StringUtils.trim(output),
                    MAX_MESSAGE_OUTPUT));
         }

         if (LOG.isDebugEnabled()) {
            LOG.debug("dreadnaut output:\n" + output);
         }
         return output;
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new NautyException("Interrupted while waiting for " + dreadnaut, e);
      } catch (NautyException e) {
         throw e;
      } catch (IOException e) {
         throw new NautyException("Could not run " + dreadnaut, e);
      } finally {
         if (process != null) {
            process.destroy();
         }
         if (commandFile != null && !commandFile.delete()) {
            LOG.warn("Could not delete " + commandFile);
         }
      }
   }
}
