package br.ufmg.cs.systems.canon.graph;

public class ExpandedGraph {
   private final MainGraph original;
   private final MainGraph graph;
   private final int[] labels;
   private final int edgeLabel;
   private final TriangleMix triangleMix;

   public ExpandedGraph(MainGraph original, MainGraph graph, int[] labels,
                        int edgeLabel, TriangleMix triangleMix) {
      this.original = original;
      this.graph = graph;
      this.labels = labels;
      this.edgeLabel = edgeLabel;
      this.triangleMix = triangleMix;
   }

   /**
    * The graph itself, used when no expansion is wanted.
    */
   public static ExpandedGraph identity(MainGraph graph, int[] labels) {
      return new ExpandedGraph(graph, graph, labels.clone(), -1,
              TriangleMix.NO_EDGES);
   }

   public MainGraph getOriginal() {
      return original;
   }

   public MainGraph getGraph() {
      return graph;
   }

   /**
    * Labels indexed by position of {@link #getGraph()}; the first
    * {@code original.numVertices()} entries belong to the original vertices.
    */
   public int[] getLabels() {
      return labels;
   }

   /**
    * Label reserved for vertices standing for edges, -1 when nothing was
    * expanded.
    */
   public int getEdgeLabel() {
      return edgeLabel;
   }

   public TriangleMix getTriangleMix() {
      return triangleMix;
   }

   public int numEdgeVertices() {
      return graph.numVertices() - original.numVertices();
   }

   @Override
   public String toString() {
      return "ExpandedGraph{" +
              "graph=" + graph +
              ",edgeLabel=" + edgeLabel +
              ",triangleMix=" + triangleMix +
              '}';
   }
}
