package br.ufmg.cs.systems.canon.pattern;

import java.util.Arrays;

/**
 * Outcome of looking for the next vertex to place: either the index of a
 * vertex whose key no other remaining vertex shares, or the group of
 * remaining vertices that all share the smallest key.
 */
public final class Selection {
   private final int index;
   private final int[] tiedGroup;

   private Selection(int index, int[] tiedGroup) {
      this.index = index;
      this.tiedGroup = tiedGroup;
   }

   public static Selection stable(int index) {
      return new Selection(index, null);
   }

   public static Selection needsTieBreak(int[] tiedGroup) {
      return new Selection(-1, tiedGroup);
   }

   public boolean isStable() {
      return tiedGroup == null;
   }

   /**
    * @return index into the remaining vertices, only for stable selections
    */
   public int getIndex() {
      if (!isStable()) {
         throw new IllegalStateException("Selection needs a tie break");
      }
      return index;
   }

   /**
    * @return positions of the vertices sharing the smallest key, only for
    * selections needing a tie break
    */
   public int[] getTiedGroup() {
      if (isStable()) {
         throw new IllegalStateException("Selection is stable");
      }
      return tiedGroup.clone();
   }

   @Override
   public String toString() {
      return isStable() ? "Selection{stable=" + index + "}" :
              "Selection{tied=" + Arrays.toString(tiedGroup) + "}";
   }
}
