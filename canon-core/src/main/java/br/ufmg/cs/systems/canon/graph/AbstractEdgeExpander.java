package br.ufmg.cs.systems.canon.graph;

import br.ufmg.cs.systems.canon.util.Utils;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import com.koloboke.function.IntIntConsumer;
import org.apache.log4j.Logger;

import java.util.Arrays;

/**
 * Replaces selected edges {@code (u,v)} by a fresh vertex adjacent to both
 * endpoints. Fresh vertices get ids above the largest existing id, in edge
 * enumeration order, and all carry the label {@code max(labels) + 1}.
 */
public abstract class AbstractEdgeExpander implements GraphExpander {
   private static final Logger LOG = Logger.getLogger(AbstractEdgeExpander.class);

   /**
    * @param closesTriangle whether the endpoints of the edge share a neighbour
    * @return whether the edge is replaced by an edge vertex
    */
   protected abstract boolean subdivides(boolean closesTriangle);

   @Override
   public ExpandedGraph expand(MainGraph graph, int[] labels) {
      if (labels.length != graph.numVertices()) {
         throw new IllegalArgumentException("Expected " + graph.numVertices() +
                 " labels, got " + labels.length);
      }

      if (graph.numEdges() == 0) {
         return ExpandedGraph.identity(graph, labels);
      }

      int edgeLabel = Math.addExact(PrimitiveArrays.max(labels, -1), 1);

      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      for (int pos = 0; pos < graph.numVertices(); ++pos) {
         builder.addVertex(graph.vertexId(pos));
      }

      EdgeRewriter rewriter = new EdgeRewriter(graph, builder);
      graph.forEachEdge(rewriter);

      int numEdgeVertices = rewriter.nextVertexId - graph.maxVertexId();
      int[] newLabels = Arrays.copyOf(labels, labels.length + numEdgeVertices);
      Arrays.fill(newLabels, labels.length, newLabels.length, edgeLabel);

      TriangleMix mix = TriangleMix.of(rewriter.aTriangle, rewriter.aNonTriangle);
      ExpandedGraph expanded = new ExpandedGraph(graph, builder.build(),
              newLabels, edgeLabel, mix);

      if (LOG.isDebugEnabled()) {
         LOG.debug("Expanded " + graph.numEdges() + " edges into " +
                 numEdgeVertices + " edge vertices, triangles: " + mix);
      }

      return expanded;
   }

   private class EdgeRewriter implements IntIntConsumer {
      private final MainGraph graph;
      private final BasicMainGraph.Builder builder;
      private int nextVertexId;
      private boolean aTriangle;
      private boolean aNonTriangle;

      EdgeRewriter(MainGraph graph, BasicMainGraph.Builder builder) {
         this.graph = graph;
         this.builder = builder;
         this.nextVertexId = graph.maxVertexId();
      }

      @Override
      public void accept(int u, int v) {
         boolean triangle = Utils.sintersectSize(graph.neighborhoodVertices(u),
                 graph.neighborhoodVertices(v)) > 0;
         if (triangle) {
            aTriangle = true;
         } else {
            aNonTriangle = true;
         }

         int src = graph.vertexId(u);
         int dst = graph.vertexId(v);
         if (subdivides(triangle)) {
            ++nextVertexId;
            builder.addEdge(src, nextVertexId);
            builder.addEdge(dst, nextVertexId);
         } else {
            builder.addEdge(src, dst);
         }
      }
   }
}
