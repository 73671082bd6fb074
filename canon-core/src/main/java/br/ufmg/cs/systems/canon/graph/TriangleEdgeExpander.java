package br.ufmg.cs.systems.canon.graph;

/**
 * Subdivides only the edges lying on a triangle and keeps the others as
 * direct edges.
 */
public class TriangleEdgeExpander extends AbstractEdgeExpander {
   @Override
   protected boolean subdivides(boolean closesTriangle) {
      return closesTriangle;
   }
}
