package br.ufmg.cs.systems.canon.graph;

import br.ufmg.cs.systems.canon.util.InvalidLabelMapException;
import com.koloboke.collect.IntCursor;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Conversions between external label maps (vertex id to label) and the
 * position-indexed label arrays the engine works with.
 */
public class VertexLabels {

   /**
    * @param labels vertex id to label, or null for all-zero labels
    * @return labels indexed by vertex position
    * @throws InvalidLabelMapException if a vertex has no label or a label
    * names a vertex the graph does not have
    */
   public static int[] fromMap(MainGraph graph, @Nullable IntIntMap labels) {
      int numVertices = graph.numVertices();
      int[] result = new int[numVertices];

      if (labels == null) {
         return result;
      }

      for (int pos = 0; pos < numVertices; ++pos) {
         int vertexId = graph.vertexId(pos);
         if (!labels.containsKey(vertexId)) {
            throw new InvalidLabelMapException("Missing label", vertexId);
         }
         result[pos] = labels.get(vertexId);
      }

      if (labels.size() != numVertices) {
         IntCursor cur = labels.keySet().cursor();
         int extra = Integer.MAX_VALUE;
         while (cur.moveNext()) {
            if (!graph.containsVertex(cur.elem())) {
               extra = Math.min(extra, cur.elem());
            }
         }
         throw new InvalidLabelMapException("Label for unknown vertex", extra);
      }

      return result;
   }

   public static IntIntMap toMap(MainGraph graph, int[] labels) {
      IntIntMap map = HashIntIntMaps.newMutableMap(labels.length);
      for (int pos = 0; pos < labels.length; ++pos) {
         map.put(graph.vertexId(pos), labels[pos]);
      }
      return map;
   }

   public static IntIntMap uniform(MainGraph graph, int label) {
      int[] labels = new int[graph.numVertices()];
      Arrays.fill(labels, label);
      return toMap(graph, labels);
   }
}
