package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;

/**
 * Refinement driven by nodewise overlays. In each round, every vertex
 * {@code p} runs a plain refinement over labels combining its overlay with
 * the current labels; the vertex is then keyed by its label, the label it
 * got in its own run, and the run itself. The labels of each run become the
 * overlay of the next round.
 */
public class OverlayRefiner {
   private static final Logger LOG = Logger.getLogger(OverlayRefiner.class);

   private final MainGraph graph;
   private final ColorRefiner colorRefiner;

   public OverlayRefiner(MainGraph graph) {
      this.graph = graph;
      this.colorRefiner = new ColorRefiner(graph);
   }

   public OverlayRefinement refine(int[] initialLabels, Overlays initialOverlays) {
      int numVertices = graph.numVertices();
      if (initialLabels.length != numVertices ||
              initialOverlays.numVertices() != numVertices) {
         throw new IllegalArgumentException("Labels and overlays must cover the " +
                 numVertices + " vertices of the graph");
      }
      if (numVertices == 0) {
         return new OverlayRefinement(new int[0], Overlays.EMPTY,
                 Collections.emptyList(), new int[]{0}, 0);
      }

      // combined labels are overlay * multiplier + label, with label < multiplier
      long multiplier = Math.max(numVertices,
              (long) PrimitiveArrays.max(initialLabels, 0) + 1);

      int[] labels = initialLabels.clone();
      Overlays overlays = initialOverlays;
      int[] labelCounts = new int[numVertices + 2];
      int numLabelCounts = 0;
      labelCounts[numLabelCounts++] = PrimitiveArrays.countDistinct(labels);

      int rounds = 0;
      LabelAssignment<NodeSignature> assignment;
      while (true) {
         NodeSignature[] keys = new NodeSignature[numVertices];
         long[][] nextOverlays = new long[numVertices][];
         for (int p = 0; p < numVertices; ++p) {
            long[] combined = new long[numVertices];
            for (int pos = 0; pos < numVertices; ++pos) {
               combined[pos] = Math.addExact(
                       Math.multiplyExact(overlays.get(p, pos), multiplier),
                       labels[pos]);
            }
            RefinementResult overlayRun = colorRefiner.refine(combined);
            keys[p] = new NodeSignature(labels[p], overlayRun.labelOf(p), overlayRun);
            nextOverlays[p] = PrimitiveArrays.toLongArray(overlayRun.getLabels());
         }

         assignment = LabelAssignment.assign(keys);
         overlays = new Overlays(nextOverlays);
         LabelAssignment.checkProgress(labels, assignment.getLabels(), rounds,
                 numVertices);
         labelCounts[numLabelCounts++] = assignment.numLabels();

         if (LabelAssignment.sameGrouping(labels, assignment.getLabels())) {
            break;
         }

         labels = assignment.getLabels();
         ++rounds;

         if (LOG.isDebugEnabled()) {
            LOG.debug("Overlay round " + rounds + " produced " +
                    assignment.numLabels() + " labels");
         }
      }

      return new OverlayRefinement(assignment.getLabels(), overlays,
              assignment.getDefinitions(),
              Arrays.copyOf(labelCounts, numLabelCounts), rounds);
   }
}
