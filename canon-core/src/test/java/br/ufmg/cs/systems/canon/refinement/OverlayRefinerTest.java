package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.GraphFixtures;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class OverlayRefinerTest {

   private static OverlayRefinement refine(MainGraph graph, int[] labels) {
      Overlays overlays = new NodewiseOverlayBuilder(graph).build(labels);
      return new OverlayRefiner(graph).refine(labels, overlays);
   }

   @Test
   public void testPathSplitsEndpointsFromMiddle() {
      OverlayRefinement refinement = refine(GraphFixtures.path(3), new int[3]);

      assertEquals(2, refinement.numLabels());
      assertEquals(refinement.labelOf(0), refinement.labelOf(2));
      assertNotEquals(refinement.labelOf(0), refinement.labelOf(1));
      assertEquals(1, refinement.getRounds());
   }

   @Test
   public void testCycleOverlaysFollowDistances() {
      OverlayRefinement refinement = refine(GraphFixtures.cycle(6), new int[6]);
      Overlays overlays = refinement.getOverlays();

      assertEquals(1, refinement.numLabels());
      assertEquals(0, refinement.getRounds());

      assertEquals(overlays.get(0, 1), overlays.get(0, 5));
      assertEquals(overlays.get(0, 2), overlays.get(0, 4));
      Set<Long> distinct = new HashSet<>();
      for (int pos = 0; pos < 4; ++pos) {
         distinct.add(overlays.get(0, pos));
      }
      assertEquals(4, distinct.size());
   }

   @Test
   public void testSignaturesSeparateWhatColorRefinementCannot() {
      OverlayRefinement cycle = refine(GraphFixtures.cycle(6), new int[6]);
      OverlayRefinement triangles = refine(GraphFixtures.twoTriangles(), new int[6]);

      assertEquals(1, cycle.numLabels());
      assertEquals(1, triangles.numLabels());
      assertNotEquals(0, cycle.getDefinitions().get(0)
              .compareTo(triangles.getDefinitions().get(0)));
   }

   @Test
   public void testExternalLabelsAreRespected() {
      OverlayRefinement refinement = refine(GraphFixtures.cycle(4), new int[]{3, 0, 3, 0});

      assertEquals(2, refinement.numLabels());
      assertTrue(refinement.labelOf(0) > refinement.labelOf(1));
      assertEquals(refinement.labelOf(0), refinement.labelOf(2));
      assertEquals(refinement.labelOf(1), refinement.labelOf(3));
   }

   @Test
   public void testEmptyGraph() {
      OverlayRefinement refinement = new OverlayRefiner(BasicMainGraph.EMPTY)
              .refine(new int[0], Overlays.EMPTY);
      assertEquals(0, refinement.numVertices());
   }

   @Test(expected = IllegalArgumentException.class)
   public void testOverlayCountMismatch() {
      new OverlayRefiner(GraphFixtures.path(3)).refine(new int[3], Overlays.EMPTY);
   }
}
