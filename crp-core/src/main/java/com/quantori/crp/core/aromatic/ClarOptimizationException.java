package com.quantori.crp.core.aromatic;

import com.quantori.crp.core.ResonanceException;

/**
 * Thrown when the sextet assignment program of a molecule has no solution at all.
 */
public class ClarOptimizationException extends ResonanceException {

  /**
   * Constructs a {@code ClarOptimizationException} with the specified detail message.
   *
   * @param message the detail message
   */
  public ClarOptimizationException(String message) {
    super(message);
  }

  public ClarOptimizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
