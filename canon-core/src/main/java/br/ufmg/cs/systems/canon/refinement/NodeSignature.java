package br.ufmg.cs.systems.canon.refinement;

/**
 * Key of a vertex in an overlay-driven round: its current label, the label
 * its own overlay run gave it, and that whole run.
 */
public class NodeSignature implements Comparable<NodeSignature> {
   private final int label;
   private final int ownOverlayLabel;
   private final RefinementResult overlayRun;

   public NodeSignature(int label, int ownOverlayLabel,
                        RefinementResult overlayRun) {
      this.label = label;
      this.ownOverlayLabel = ownOverlayLabel;
      this.overlayRun = overlayRun;
   }

   public int getLabel() {
      return label;
   }

   public int getOwnOverlayLabel() {
      return ownOverlayLabel;
   }

   public RefinementResult getOverlayRun() {
      return overlayRun;
   }

   @Override
   public int compareTo(NodeSignature o) {
      if (label != o.label) {
         return Integer.compare(label, o.label);
      }
      if (ownOverlayLabel != o.ownOverlayLabel) {
         return Integer.compare(ownOverlayLabel, o.ownOverlayLabel);
      }
      return overlayRun.compareTo(o.overlayRun);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return compareTo((NodeSignature) o) == 0;
   }

   @Override
   public int hashCode() {
      int result = label;
      result = 31 * result + ownOverlayLabel;
      result = 31 * result + overlayRun.hashCode();
      return result;
   }

   @Override
   public String toString() {
      return "NodeSignature{" + label + "," + ownOverlayLabel + "}";
   }
}
