package br.ufmg.cs.systems.canon.util;

/**
 * External labels that do not match the vertex set of the graph they were
 * given with: a vertex without a label or a label for a vertex that does not
 * exist.
 */
public class InvalidLabelMapException extends CanonException {
   private final int vertexId;

   public InvalidLabelMapException(String message, int vertexId) {
      super(message + " (vertex " + vertexId + ")");
      this.vertexId = vertexId;
   }

   public int getVertexId() {
      return vertexId;
   }
}
