package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;

import java.util.Arrays;
import java.util.List;

/**
 * Stabilized coloring produced by {@link ColorRefiner}. Two results compare
 * equal when their sorted (label, input label) pairs and their label
 * definitions match, which is what nodewise overlay runs need to tell
 * vertices apart.
 */
public class RefinementResult extends RefinementOutcome
        implements Comparable<RefinementResult> {
   private final int[] labels;
   private final long[] inputLabels;
   private final List<LabelDefinition> definitions;
   private final int[] labelCounts;
   private final int rounds;

   // (label, input label) pairs sorted lexicographically
   private final int[] pairLabels;
   private final long[] pairInputs;

   public RefinementResult(int[] labels, long[] inputLabels,
                           List<LabelDefinition> definitions,
                           int[] labelCounts, int rounds) {
      this.labels = labels;
      this.inputLabels = inputLabels;
      this.definitions = definitions;
      this.labelCounts = labelCounts;
      this.rounds = rounds;

      int numVertices = labels.length;
      int[] order = PrimitiveArrays.identity(numVertices);
      PrimitiveArrays.sort(order, (a, b) -> {
         if (labels[a] != labels[b]) {
            return Integer.compare(labels[a], labels[b]);
         }
         return Long.compare(inputLabels[a], inputLabels[b]);
      });
      this.pairLabels = new int[numVertices];
      this.pairInputs = new long[numVertices];
      for (int i = 0; i < numVertices; ++i) {
         pairLabels[i] = labels[order[i]];
         pairInputs[i] = inputLabels[order[i]];
      }
   }

   public int[] getLabels() {
      return labels.clone();
   }

   public int labelOf(int pos) {
      return labels[pos];
   }

   public long inputLabelOf(int pos) {
      return inputLabels[pos];
   }

   public int numVertices() {
      return labels.length;
   }

   public int numLabels() {
      return definitions.size();
   }

   public List<LabelDefinition> getDefinitions() {
      return definitions;
   }

   /**
    * @return number of distinct labels before the first round and after each
    * round, in order
    */
   public int[] getLabelCounts() {
      return labelCounts.clone();
   }

   public int getRounds() {
      return rounds;
   }

   @Override
   public boolean isCanonical() {
      return false;
   }

   @Override
   public int compareSameKind(RefinementOutcome other) {
      return compareTo((RefinementResult) other);
   }

   @Override
   public int compareTo(RefinementResult o) {
      int len = Math.min(pairLabels.length, o.pairLabels.length);
      for (int i = 0; i < len; ++i) {
         if (pairLabels[i] != o.pairLabels[i]) {
            return Integer.compare(pairLabels[i], o.pairLabels[i]);
         }
         if (pairInputs[i] != o.pairInputs[i]) {
            return Long.compare(pairInputs[i], o.pairInputs[i]);
         }
      }
      if (pairLabels.length != o.pairLabels.length) {
         return Integer.compare(pairLabels.length, o.pairLabels.length);
      }

      int numDefinitions = Math.min(definitions.size(), o.definitions.size());
      for (int i = 0; i < numDefinitions; ++i) {
         int r = definitions.get(i).compareTo(o.definitions.get(i));
         if (r != 0) {
            return r;
         }
      }
      return Integer.compare(definitions.size(), o.definitions.size());
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return compareTo((RefinementResult) o) == 0;
   }

   @Override
   public int hashCode() {
      int result = Arrays.hashCode(pairLabels);
      result = 31 * result + Arrays.hashCode(pairInputs);
      result = 31 * result + definitions.hashCode();
      return result;
   }

   @Override
   public String toString() {
      return "RefinementResult{" +
              "labels=" + Arrays.toString(labels) +
              ", numLabels=" + numLabels() +
              ", rounds=" + rounds +
              '}';
   }
}
