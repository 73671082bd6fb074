package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.util.InvariantViolationException;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One relabeling step: vertices sorted by key get sequential labels, a new
 * label starting at every key change.
 */
class LabelAssignment<K extends Comparable<? super K>> {
   private final int[] labels;
   private final List<K> definitions;

   private LabelAssignment(int[] labels, List<K> definitions) {
      this.labels = labels;
      this.definitions = definitions;
   }

   static <K extends Comparable<? super K>> LabelAssignment<K> assign(K[] keys) {
      int numVertices = keys.length;
      int[] order = PrimitiveArrays.identity(numVertices);
      PrimitiveArrays.sort(order, (a, b) -> {
         int r = keys[a].compareTo(keys[b]);
         return r != 0 ? r : Integer.compare(a, b);
      });

      int[] labels = new int[numVertices];
      List<K> definitions = new ArrayList<>();
      int nextLabel = -1;
      K prev = null;
      for (int i = 0; i < numVertices; ++i) {
         K current = keys[order[i]];
         if (prev == null || prev.compareTo(current) != 0) {
            ++nextLabel;
            definitions.add(current);
         }
         labels[order[i]] = nextLabel;
         prev = current;
      }

      return new LabelAssignment<>(labels, Collections.unmodifiableList(definitions));
   }

   /**
    * Whether two labelings induce the same partition, whatever numbers they
    * use: the first vertex met with each label must be the same under both.
    */
   static boolean sameGrouping(int[] oldLabels, int[] newLabels) {
      IntIntMap oldGroupIdentifiers = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap();
      IntIntMap newGroupIdentifiers = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap();

      for (int pos = 0; pos < oldLabels.length; ++pos) {
         int oldRepresentative = oldGroupIdentifiers.putIfAbsent(oldLabels[pos], pos);
         if (oldRepresentative == -1) oldRepresentative = pos;
         int newRepresentative = newGroupIdentifiers.putIfAbsent(newLabels[pos], pos);
         if (newRepresentative == -1) newRepresentative = pos;

         if (oldRepresentative != newRepresentative) {
            return false;
         }
      }

      return true;
   }

   /**
    * Fails when a round put vertices with different old labels under one new
    * label, or when the round count went past the number of vertices.
    */
   static void checkProgress(int[] oldLabels, int[] newLabels, int rounds,
                             int numVertices) {
      // K = new label, V = old label of the first vertex seen with it
      IntIntMap oldLabelOf = HashIntIntMaps.newMutableMap();
      for (int pos = 0; pos < newLabels.length; ++pos) {
         int expected = oldLabelOf.getOrDefault(newLabels[pos], oldLabels[pos]);
         if (expected != oldLabels[pos]) {
            throw new InvariantViolationException("Refinement round merged labels " +
                    expected + " and " + oldLabels[pos] + " into " + newLabels[pos]);
         }
         oldLabelOf.put(newLabels[pos], oldLabels[pos]);
      }
      if (rounds > numVertices) {
         throw new InvariantViolationException("Refinement did not stabilize after " +
                 rounds + " rounds on " + numVertices + " vertices");
      }
   }

   int[] getLabels() {
      return labels;
   }

   List<K> getDefinitions() {
      return definitions;
   }

   int numLabels() {
      return definitions.size();
   }
}
