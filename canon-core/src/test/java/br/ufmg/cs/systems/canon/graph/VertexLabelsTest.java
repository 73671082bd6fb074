package br.ufmg.cs.systems.canon.graph;

import br.ufmg.cs.systems.canon.util.InvalidLabelMapException;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class VertexLabelsTest {

   @Test
   public void testLabelsFollowPositions() {
      BasicMainGraph graph = BasicMainGraph.builder()
              .addEdge(30, 10).addEdge(10, 20).build();
      IntIntMap labels = HashIntIntMaps.newMutableMap();
      labels.put(10, 4);
      labels.put(20, 0);
      labels.put(30, 9);

      assertArrayEquals(new int[]{4, 0, 9}, VertexLabels.fromMap(graph, labels));
      assertEquals(labels, VertexLabels.toMap(graph, new int[]{4, 0, 9}));
   }

   @Test
   public void testNullMeansUniform() {
      assertArrayEquals(new int[]{0, 0, 0},
              VertexLabels.fromMap(GraphFixtures.path(3), null));
   }

   @Test
   public void testMissingLabel() {
      try {
         VertexLabels.fromMap(GraphFixtures.path(3), GraphFixtures.labels(0, 0));
         fail();
      } catch (InvalidLabelMapException e) {
         assertEquals(2, e.getVertexId());
      }
   }

   @Test
   public void testLabelForUnknownVertex() {
      try {
         VertexLabels.fromMap(GraphFixtures.path(2), GraphFixtures.labels(0, 0, 0, 1));
         fail();
      } catch (InvalidLabelMapException e) {
         assertEquals(2, e.getVertexId());
      }
   }

   @Test
   public void testNegativeAndExtremeLabelsKept() {
      int[] labels = VertexLabels.fromMap(GraphFixtures.path(3),
              GraphFixtures.labels(-3, Integer.MAX_VALUE, Integer.MIN_VALUE));
      assertArrayEquals(new int[]{-3, Integer.MAX_VALUE, Integer.MIN_VALUE}, labels);
   }
}
