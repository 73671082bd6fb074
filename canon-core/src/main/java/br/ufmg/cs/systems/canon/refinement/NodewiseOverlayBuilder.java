package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.graph.BreadthFirstDistances;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import org.apache.log4j.Logger;

/**
 * Builds the initial overlays: overlay {@code p} keeps every vertex's
 * external label and gives {@code p} a value no other vertex carries.
 */
public class NodewiseOverlayBuilder {
   private static final Logger LOG = Logger.getLogger(NodewiseOverlayBuilder.class);

   private final MainGraph graph;

   public NodewiseOverlayBuilder(MainGraph graph) {
      this.graph = graph;
   }

   public Overlays build(int[] externalLabels) {
      int numVertices = graph.numVertices();
      if (externalLabels.length != numVertices) {
         throw new IllegalArgumentException("Expected " + numVertices +
                 " labels, got " + externalLabels.length);
      }
      if (numVertices == 0) {
         return Overlays.EMPTY;
      }

      int[] basicLabels = new ColorRefiner(graph).refine(externalLabels).getLabels();
      long maxExternalLabel = PrimitiveArrays.max(externalLabels, 0);

      long[][] values = new long[numVertices][];
      for (int p = 0; p < numVertices; ++p) {
         long individualValue = Math.max(headStartMax(p, basicLabels),
                 maxExternalLabel) + 1;
         long[] overlay = PrimitiveArrays.toLongArray(externalLabels);
         overlay[p] = individualValue;
         values[p] = overlay;
      }

      if (LOG.isDebugEnabled()) {
         LOG.debug("Built " + numVertices + " nodewise overlays");
      }

      return new Overlays(values);
   }

   /**
    * Largest distance-plus-coloring value seen from {@code p}. Only the
    * maximum is kept: it bounds the value given to {@code p} itself.
    */
   private long headStartMax(int p, int[] basicLabels) {
      int numVertices = basicLabels.length;
      int[] distances = BreadthFirstDistances.fromClosed(graph, p);
      long max = Long.MIN_VALUE;
      for (int pos = 0; pos < numVertices; ++pos) {
         long headStart = distances[pos] + (long) basicLabels[pos] * numVertices;
         max = Math.max(max, headStart);
      }
      return max;
   }
}
