package br.ufmg.cs.systems.canon.pattern;

import br.ufmg.cs.systems.canon.conf.Configuration;
import br.ufmg.cs.systems.canon.graph.ExpandedGraph;
import br.ufmg.cs.systems.canon.graph.GraphExpander;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.graph.VertexLabels;
import br.ufmg.cs.systems.canon.refinement.NodewiseOverlayBuilder;
import br.ufmg.cs.systems.canon.refinement.OverlayRefinement;
import br.ufmg.cs.systems.canon.refinement.OverlayRefiner;
import br.ufmg.cs.systems.canon.refinement.Overlays;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import com.koloboke.collect.map.IntIntMap;
import org.apache.log4j.Logger;

import javax.annotation.Nullable;

/**
 * Entry point for computing canonical forms. A top-level run expands the
 * graph, builds nodewise overlays over the expanded graph, refines to a
 * fixpoint and orders the original vertices. Instances hold no per-call
 * state.
 */
public class Canonizer {
   private static final Logger LOG = Logger.getLogger(Canonizer.class);

   private final Configuration configuration;
   private final GraphExpander expander;

   public Canonizer() {
      this(new Configuration());
   }

   public Canonizer(Configuration configuration) {
      this.configuration = configuration;
      this.expander = configuration.createGraphExpander();
   }

   public Configuration getConfiguration() {
      return configuration;
   }

   /**
    * Canonical form of an unlabeled graph: every vertex gets label 0.
    */
   public CanonicalForm canonicalize(MainGraph graph) {
      return canonicalize(graph, null);
   }

   public CanonicalForm canonicalize(MainGraph graph, @Nullable IntIntMap labels) {
      return canonicalize(graph, labels, configuration.isExpandEnabled());
   }

   /**
    * @param labels vertex id to label, one entry per vertex; null means all
    *               vertices share label 0
    * @param expand whether edges are turned into vertices before refinement
    * @throws br.ufmg.cs.systems.canon.util.InvalidLabelMapException when the
    * label map does not match the graph
    */
   public CanonicalForm canonicalize(MainGraph graph, @Nullable IntIntMap labels,
                                     boolean expand) {
      int[] externalLabels = VertexLabels.fromMap(graph, labels);
      if (graph.numVertices() == 0) {
         return CanonicalForm.empty();
      }

      OverlayRefinement refinement = refine(graph, externalLabels, expand);
      LOG.info(String.format(
              "Took a total of %s rounds to first get the correct labels.",
              refinement.getRounds()));

      CanonicalOrderer orderer = new CanonicalOrderer(graph, externalLabels,
              refinement.getLabels(), refinement.getOverlays(),
              tieBreakLabels -> refine(graph, tieBreakLabels, expand).getLabels(),
              configuration.logTies());

      CanonicalForm form = orderer.order();
      if (LOG.isDebugEnabled()) {
         LOG.debug("Canonical form " + form);
      }
      return form;
   }

   /**
    * Stabilized overlay-driven refinement of {@code graph} under
    * {@code labels}, without ordering. Positions below
    * {@code graph.numVertices()} are those of {@code graph}; any further ones
    * belong to vertices added by expansion.
    */
   public OverlayRefinement refine(MainGraph graph, @Nullable IntIntMap labels) {
      return refine(graph, VertexLabels.fromMap(graph, labels),
              configuration.isExpandEnabled());
   }

   /**
    * Labels are replaced by their dense ranks first, so only their order
    * matters to refinement.
    */
   OverlayRefinement refine(MainGraph graph, int[] labels, boolean expand) {
      int[] ranks = PrimitiveArrays.denseRanks(PrimitiveArrays.toLongArray(labels));
      ExpandedGraph expanded = expand ? expander.expand(graph, ranks) :
              ExpandedGraph.identity(graph, ranks);

      MainGraph workingGraph = expanded.getGraph();
      int[] workingLabels = expanded.getLabels();

      Overlays overlays = new NodewiseOverlayBuilder(workingGraph).build(workingLabels);
      return new OverlayRefiner(workingGraph).refine(workingLabels, overlays);
   }

   public int compare(CanonicalForm a, CanonicalForm b) {
      return CanonicalFormComparator.INSTANCE.compare(a, b);
   }

   public boolean equals(CanonicalForm a, CanonicalForm b) {
      return CanonicalFormComparator.equals(a, b);
   }
}
