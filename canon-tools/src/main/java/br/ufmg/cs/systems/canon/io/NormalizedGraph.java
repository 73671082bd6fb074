package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import com.koloboke.collect.map.IntIntMap;

import javax.annotation.Nullable;

/**
 * A graph renumbered to ids {@code 0..n-1}, with the mappings back and forth
 * between original and dense ids.
 */
public class NormalizedGraph {
   private final MainGraph graph;
   private final IntIntMap labels;
   private final IntIntMap originalToDense;
   private final int[] denseToOriginal;

   public NormalizedGraph(MainGraph graph, @Nullable IntIntMap labels,
                          IntIntMap originalToDense, int[] denseToOriginal) {
      this.graph = graph;
      this.labels = labels;
      this.originalToDense = originalToDense;
      this.denseToOriginal = denseToOriginal;
   }

   public MainGraph getGraph() {
      return graph;
   }

   /**
    * @return labels keyed by dense id, or null when the graph is unlabeled
    */
   @Nullable
   public IntIntMap getLabels() {
      return labels;
   }

   public int toDense(int originalId) {
      return originalToDense.get(originalId);
   }

   public int toOriginal(int denseId) {
      return denseToOriginal[denseId];
   }

   public int[] toOriginal(int[] denseIds) {
      int[] originalIds = new int[denseIds.length];
      for (int i = 0; i < denseIds.length; ++i) {
         originalIds[i] = denseToOriginal[denseIds[i]];
      }
      return originalIds;
   }
}
