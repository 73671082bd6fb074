package br.ufmg.cs.systems.canon.refinement;

import java.util.List;

/**
 * Fixpoint of an overlay-driven refinement: the internal labels together
 * with the overlays of the last round.
 */
public class OverlayRefinement {
   private final int[] labels;
   private final Overlays overlays;
   private final List<NodeSignature> definitions;
   private final int[] labelCounts;
   private final int rounds;

   public OverlayRefinement(int[] labels, Overlays overlays,
                            List<NodeSignature> definitions,
                            int[] labelCounts, int rounds) {
      this.labels = labels;
      this.overlays = overlays;
      this.definitions = definitions;
      this.labelCounts = labelCounts;
      this.rounds = rounds;
   }

   public int[] getLabels() {
      return labels.clone();
   }

   public int labelOf(int pos) {
      return labels[pos];
   }

   public int numVertices() {
      return labels.length;
   }

   public int numLabels() {
      return definitions.size();
   }

   public Overlays getOverlays() {
      return overlays;
   }

   public List<NodeSignature> getDefinitions() {
      return definitions;
   }

   public int[] getLabelCounts() {
      return labelCounts.clone();
   }

   /**
    * @return rounds that changed the partition
    */
   public int getRounds() {
      return rounds;
   }
}
