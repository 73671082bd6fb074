package br.ufmg.cs.systems.canon.graph;

/**
 * Rewrites a graph so that edges become vertices carrying a dedicated label,
 * leaving refinement to reason about vertex labels and adjacency only.
 *
 * Implementations keep every original vertex with its id and label and
 * allocate fresh ids strictly above the largest existing one, so original
 * vertices keep their positions in the expanded graph.
 */
public interface GraphExpander {
   /**
    * @param labels labels indexed by position of {@code graph}
    */
   ExpandedGraph expand(MainGraph graph, int[] labels);
}
