package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;

import java.util.Arrays;

/**
 * Signature of a vertex in a plain refinement round: its current label and
 * the sorted labels of its neighbours.
 */
public class LabelDefinition implements Comparable<LabelDefinition> {
   private final int label;
   private final int[] neighborLabels;

   public LabelDefinition(int label, int[] neighborLabels) {
      this.label = label;
      this.neighborLabels = neighborLabels;
   }

   public static LabelDefinition of(MainGraph graph, int[] labels, int pos) {
      int[] neighbours = graph.neighborhoodVertices(pos);
      int[] neighborLabels = new int[neighbours.length];
      for (int i = 0; i < neighbours.length; ++i) {
         neighborLabels[i] = labels[neighbours[i]];
      }
      Arrays.sort(neighborLabels);
      return new LabelDefinition(labels[pos], neighborLabels);
   }

   public int getLabel() {
      return label;
   }

   public int[] getNeighborLabels() {
      return neighborLabels.clone();
   }

   @Override
   public int compareTo(LabelDefinition o) {
      if (label != o.label) {
         return Integer.compare(label, o.label);
      }
      return PrimitiveArrays.compare(neighborLabels, o.neighborLabels);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      LabelDefinition that = (LabelDefinition) o;

      if (label != that.label) return false;
      return Arrays.equals(neighborLabels, that.neighborLabels);
   }

   @Override
   public int hashCode() {
      int result = label;
      result = 31 * result + Arrays.hashCode(neighborLabels);
      return result;
   }

   @Override
   public String toString() {
      return "(" + label + "," + Arrays.toString(neighborLabels) + ")";
   }
}
