package br.ufmg.cs.systems.canon.util;

/**
 * Base class of the unchecked failures raised by the canonicalization engine.
 */
public class CanonException extends RuntimeException {
   public CanonException(String message) {
      super(message);
   }

   public CanonException(String message, Throwable cause) {
      super(message, cause);
   }
}
