package br.ufmg.cs.systems.canon.nauty;

import java.io.IOException;

/**
 * Failure running dreadnaut or reading its report.
 */
public class NautyException extends IOException {
   public NautyException(String message) {
      super(message);
   }

   public NautyException(String message, Throwable cause) {
      super(message, cause);
   }
}
