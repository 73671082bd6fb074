package br.ufmg.cs.systems.canon.graph;

/**
 * Which kinds of edges an expansion met: edges closing a triangle, edges that
 * do not, or both.
 */
public enum TriangleMix {
   NO_EDGES,
   ALL_TRIANGLES,
   NO_TRIANGLES,
   MIXED;

   public static TriangleMix of(boolean aTriangle, boolean aNonTriangle) {
      if (aNonTriangle) {
         return aTriangle ? MIXED : NO_TRIANGLES;
      }
      return aTriangle ? ALL_TRIANGLES : NO_EDGES;
   }
}
