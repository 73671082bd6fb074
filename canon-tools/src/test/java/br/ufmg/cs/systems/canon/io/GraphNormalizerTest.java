package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class GraphNormalizerTest {

   @Test
   public void testDenseIdsFollowOriginalOrder() {
      BasicMainGraph graph = BasicMainGraph.builder()
              .addEdge(100, 20).addEdge(20, 55).addVertex(7).build();
      IntIntMap labels = HashIntIntMaps.newMutableMap();
      labels.put(7, 1);
      labels.put(20, 2);
      labels.put(55, 3);
      labels.put(100, 4);

      NormalizedGraph normalized = GraphNormalizer.normalize(graph, labels);
      MainGraph dense = normalized.getGraph();

      assertEquals(4, dense.numVertices());
      assertEquals(3, dense.maxVertexId());
      assertEquals(0, normalized.toDense(7));
      assertEquals(3, normalized.toDense(100));
      assertEquals(55, normalized.toOriginal(2));
      assertArrayEquals(new int[]{100, 7}, normalized.toOriginal(new int[]{3, 0}));
      assertTrue(dense.isNeighbour(1, 3));
      assertTrue(dense.isNeighbour(1, 2));
      assertEquals(4, normalized.getLabels().get(3));
   }

   @Test
   public void testBijection() {
      BasicMainGraph graph = BasicMainGraph.builder()
              .addEdge(9, 4).addEdge(4, 13).addEdge(13, 2).build();
      NormalizedGraph normalized = GraphNormalizer.normalize(graph, null);

      for (int pos = 0; pos < graph.numVertices(); ++pos) {
         int id = graph.vertexId(pos);
         assertEquals(id, normalized.toOriginal(normalized.toDense(id)));
      }
      assertEquals(graph.numEdges(), normalized.getGraph().numEdges());
      assertNull(normalized.getLabels());
   }
}
