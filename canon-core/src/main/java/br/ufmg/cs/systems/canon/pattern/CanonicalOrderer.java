package br.ufmg.cs.systems.canon.pattern;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.refinement.Overlays;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.function.IntToLongFunction;

/**
 * Turns stabilized internal labels and overlays into a canonical vertex
 * order. Remaining vertices carry a sort key that is refined, step by step,
 * by the overlay of the last placed vertex. The first vertex whose key is
 * unique is placed next; when every key is shared, a new refinement seeded
 * with the partial order decides.
 */
public class CanonicalOrderer {
   private static final Logger LOG = Logger.getLogger(CanonicalOrderer.class);

   /**
    * Full refinement of the graph under the given labels, indexed by vertex
    * position. The result covers at least every position of the graph.
    */
   public interface TieBreaker {
      int[] refine(int[] labels);
   }

   private final MainGraph graph;
   private final int[] externalLabels;
   private final int[] internalLabels;
   private final Overlays overlays;
   private final TieBreaker tieBreaker;
   private final boolean logTies;

   /**
    * @param internalLabels stabilized labels, at least one per graph position
    * @param overlays       overlays of the stabilized run; the first
    *                       positions must match those of {@code graph}
    */
   public CanonicalOrderer(MainGraph graph, int[] externalLabels,
                           int[] internalLabels, Overlays overlays,
                           TieBreaker tieBreaker, boolean logTies) {
      this.graph = graph;
      this.externalLabels = externalLabels;
      this.internalLabels = internalLabels;
      this.overlays = overlays;
      this.tieBreaker = tieBreaker;
      this.logTies = logTies;
   }

   public CanonicalForm order() {
      int numVertices = graph.numVertices();
      if (numVertices == 0) {
         return CanonicalForm.empty();
      }

      int[] remaining = PrimitiveArrays.identity(numVertices);
      int numRemaining = numVertices;
      int[] keys = new int[numVertices];
      int[] finalOrder = new int[numVertices];

      furtherSort(remaining, numRemaining, keys, pos -> internalLabels[pos]);
      finalOrder[0] = remaining[0];
      numRemaining = remove(remaining, numRemaining, 0);

      for (int i = 1; i < numVertices; ++i) {
         final int last = finalOrder[i - 1];
         furtherSort(remaining, numRemaining, keys, pos -> overlays.get(last, pos));

         Selection selection = select(remaining, numRemaining, keys);
         int index;
         if (selection.isStable()) {
            index = selection.getIndex();
         } else {
            if (LOG.isDebugEnabled()) {
               LOG.debug("Breaking tie among " +
                       Arrays.toString(selection.getTiedGroup()) +
                       " at position " + i);
            }
            int[] tieBreakLabels = tieBreakLabels(finalOrder, i, remaining,
                    numRemaining, keys);
            int[] refined = tieBreaker.refine(tieBreakLabels);
            furtherSort(remaining, numRemaining, keys, pos -> refined[pos]);
            index = 0;
            if (numRemaining > 1 && keys[remaining[0]] == keys[remaining[1]]) {
               logTie(i + 1);
            }
         }

         finalOrder[i] = remaining[index];
         numRemaining = remove(remaining, numRemaining, index);
      }

      return buildForm(finalOrder);
   }

   /**
    * Placed vertices get their placement index; remaining ones get their key
    * shifted past every placement index.
    */
   private int[] tieBreakLabels(int[] finalOrder, int numPlaced,
                                int[] remaining, int numRemaining, int[] keys) {
      int[] labels = new int[graph.numVertices()];
      for (int j = 0; j < numPlaced; ++j) {
         labels[finalOrder[j]] = j;
      }
      for (int j = 0; j < numRemaining; ++j) {
         labels[remaining[j]] = keys[remaining[j]] + numPlaced;
      }
      return labels;
   }

   private void logTie(int position) {
      String message = String.format(
              "Chose the %dth node with a tie (1-indexed).", position);
      if (logTies) {
         LOG.info(message);
      } else if (LOG.isDebugEnabled()) {
         LOG.debug(message);
      }
   }

   private CanonicalForm buildForm(int[] finalOrder) {
      int numVertices = finalOrder.length;
      int[] nodeOrder = new int[numVertices];
      int[] orderedLabels = new int[numVertices];
      boolean[][] matrix = new boolean[numVertices][];

      for (int i = 0; i < numVertices; ++i) {
         nodeOrder[i] = graph.vertexId(finalOrder[i]);
         orderedLabels[i] = externalLabels[finalOrder[i]];
         matrix[i] = new boolean[numVertices - 1 - i];
         for (int j = i + 1; j < numVertices; ++j) {
            matrix[i][j - i - 1] = graph.isNeighbour(finalOrder[i], finalOrder[j]);
         }
      }

      return new CanonicalForm(nodeOrder, orderedLabels, matrix);
   }

   /**
    * Re-sorts the first {@code numRemaining} entries of {@code remaining} by
    * (current key, value) and replaces the keys with the dense ranks of those
    * pairs. Ties keep position order.
    */
   static void furtherSort(int[] remaining, int numRemaining, int[] keys,
                           IntToLongFunction values) {
      PrimitiveArrays.sort(remaining, 0, numRemaining, (a, b) -> {
         if (keys[a] != keys[b]) {
            return Integer.compare(keys[a], keys[b]);
         }
         int r = Long.compare(values.applyAsLong(a), values.applyAsLong(b));
         return r != 0 ? r : Integer.compare(a, b);
      });

      int rank = -1;
      int prevKey = 0;
      long prevValue = 0;
      for (int i = 0; i < numRemaining; ++i) {
         int pos = remaining[i];
         int key = keys[pos];
         long value = values.applyAsLong(pos);
         if (i == 0 || key != prevKey || value != prevValue) {
            ++rank;
         }
         prevKey = key;
         prevValue = value;
         keys[pos] = rank;
      }
   }

   /**
    * First vertex, in current sort order, whose key no other remaining vertex
    * shares.
    */
   static Selection select(int[] remaining, int numRemaining, int[] keys) {
      int i = 0;
      while (i < numRemaining) {
         int j = i + 1;
         while (j < numRemaining && keys[remaining[j]] == keys[remaining[i]]) {
            ++j;
         }
         if (j == i + 1) {
            return Selection.stable(i);
         }
         i = j;
      }

      int groupEnd = 1;
      while (groupEnd < numRemaining &&
              keys[remaining[groupEnd]] == keys[remaining[0]]) {
         ++groupEnd;
      }
      return Selection.needsTieBreak(Arrays.copyOf(remaining, groupEnd));
   }

   private static int remove(int[] remaining, int numRemaining, int index) {
      System.arraycopy(remaining, index + 1, remaining, index,
              numRemaining - index - 1);
      return numRemaining - 1;
   }
}
