package br.ufmg.cs.systems.canon.graph;

/**
 * Subdivides every edge. The default expansion.
 */
public class EdgeSubdivisionExpander extends AbstractEdgeExpander {
   @Override
   protected boolean subdivides(boolean closesTriangle) {
      return true;
   }
}
