package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.graph.VertexLabels;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import javax.annotation.Nullable;

/**
 * Renumbers vertices to {@code 0..n-1} following ascending original ids.
 * External tools such as dreadnaut expect this numbering.
 */
public class GraphNormalizer {

   public static NormalizedGraph normalize(MainGraph graph, @Nullable IntIntMap labels) {
      int numVertices = graph.numVertices();
      int[] positionLabels = labels == null ? null : VertexLabels.fromMap(graph, labels);

      IntIntMap originalToDense = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap(numVertices);
      int[] denseToOriginal = new int[numVertices];

      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      for (int pos = 0; pos < numVertices; ++pos) {
         originalToDense.put(graph.vertexId(pos), pos);
         denseToOriginal[pos] = graph.vertexId(pos);
         builder.addVertex(pos);
      }
      graph.forEachEdge(builder::addEdge);

      MainGraph normalized = builder.build();
      IntIntMap denseLabels = positionLabels == null ? null :
              VertexLabels.toMap(normalized, positionLabels);

      return new NormalizedGraph(normalized, denseLabels, originalToDense,
              denseToOriginal);
   }
}
