package br.ufmg.cs.systems.canon.refinement;

import java.util.Arrays;

/**
 * One overlay per vertex: {@code get(p, n)} is the value the overlay of
 * vertex {@code p} assigns to vertex {@code n}. Instances are never mutated;
 * each refinement round produces a new one.
 */
public final class Overlays {
   public static final Overlays EMPTY = new Overlays(new long[0][]);

   private final long[][] values;

   Overlays(long[][] values) {
      this.values = values;
   }

   public int numVertices() {
      return values.length;
   }

   public long get(int overlay, int pos) {
      return values[overlay][pos];
   }

   public long[] copyOf(int overlay) {
      return values[overlay].clone();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return Arrays.deepEquals(values, ((Overlays) o).values);
   }

   @Override
   public int hashCode() {
      return Arrays.deepHashCode(values);
   }

   @Override
   public String toString() {
      return "Overlays" + Arrays.deepToString(values);
   }
}
