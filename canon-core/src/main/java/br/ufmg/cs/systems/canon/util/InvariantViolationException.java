package br.ufmg.cs.systems.canon.util;

/**
 * Internal contract breach. Never expected with valid inputs; the computation
 * that raised it is abandoned.
 */
public class InvariantViolationException extends CanonException {
   public InvariantViolationException(String message) {
      super(message);
   }
}
