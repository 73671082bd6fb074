package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;

/**
 * Plain color refinement: every round relabels each vertex by its current
 * label and the multiset of its neighbours' labels, until the partition
 * stops changing. Input labels are replaced by their dense ranks before the
 * first round, so any long values are accepted.
 */
public class ColorRefiner {
   private static final Logger LOG = Logger.getLogger(ColorRefiner.class);

   private final MainGraph graph;

   public ColorRefiner(MainGraph graph) {
      this.graph = graph;
   }

   public RefinementResult refine(int[] inputLabels) {
      return refine(PrimitiveArrays.toLongArray(inputLabels));
   }

   public RefinementResult refine(long[] inputLabels) {
      int numVertices = graph.numVertices();
      if (inputLabels.length != numVertices) {
         throw new IllegalArgumentException("Expected " + numVertices +
                 " labels, got " + inputLabels.length);
      }

      if (numVertices == 0) {
         return new RefinementResult(new int[0], new long[0],
                 Collections.emptyList(), new int[]{0}, 0);
      }

      int[] labels = PrimitiveArrays.denseRanks(inputLabels);
      int[] labelCounts = new int[numVertices + 2];
      int numLabelCounts = 0;
      labelCounts[numLabelCounts++] = PrimitiveArrays.countDistinct(labels);

      int rounds = 0;
      LabelAssignment<LabelDefinition> assignment;
      while (true) {
         LabelDefinition[] keys = new LabelDefinition[numVertices];
         for (int pos = 0; pos < numVertices; ++pos) {
            keys[pos] = LabelDefinition.of(graph, labels, pos);
         }

         assignment = LabelAssignment.assign(keys);
         LabelAssignment.checkProgress(labels, assignment.getLabels(), rounds,
                 numVertices);
         labelCounts[numLabelCounts++] = assignment.numLabels();

         if (LabelAssignment.sameGrouping(labels, assignment.getLabels())) {
            break;
         }

         labels = assignment.getLabels();
         ++rounds;
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug("Color refinement stabilized with " + assignment.numLabels() +
                 " labels after " + rounds + " rounds");
      }

      return new RefinementResult(assignment.getLabels(), inputLabels.clone(),
              assignment.getDefinitions(),
              Arrays.copyOf(labelCounts, numLabelCounts), rounds);
   }
}
