package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import org.apache.commons.io.input.BOMInputStream;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultUndirectedGraph;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.graph6.Graph6Sparse6Importer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads graph6 and sparse6 encoded graphs, one per line, as produced by
 * nauty's {@code geng}. Vertex ids are 0 to n-1 in encoding order.
 */
public class Graph6GraphReader {

   public MainGraph parse(String encoded) throws IOException {
      Graph<Integer, Integer> graph = new DefaultUndirectedGraph<>(new ResetSupplier(),
              new ResetSupplier(), false);
      Graph6Sparse6Importer<Integer, Integer> importer = new Graph6Sparse6Importer<>();
      try {
         importer.importGraph(graph, new StringReader(encoded.trim()));
      } catch (ImportException e) {
         throw new IOException("Invalid graph6/sparse6 line: " + encoded, e);
      }

      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      for (Integer v : graph.vertexSet()) {
         builder.addVertex(v);
      }
      for (Integer e : graph.edgeSet()) {
         int src = graph.getEdgeSource(e);
         int dst = graph.getEdgeTarget(e);
         if (src != dst) {
            builder.addEdge(src, dst);
         }
      }
      return builder.build();
   }

   public List<MainGraph> readAll(InputStream is) throws IOException {
      List<MainGraph> graphs = new ArrayList<>();
      BufferedReader reader = new BufferedReader(new InputStreamReader(
              new BOMInputStream(is), StandardCharsets.US_ASCII));
      String line = reader.readLine();
      while (line != null) {
         if (!line.trim().isEmpty()) {
            graphs.add(parse(line));
         }
         line = reader.readLine();
      }
      return graphs;
   }

   private static class ResetSupplier implements Supplier<Integer> {
      private int count = 0;

      @Override
      public Integer get() {
         return count++;
      }
   }
}
