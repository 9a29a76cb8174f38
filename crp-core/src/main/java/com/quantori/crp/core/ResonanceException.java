package com.quantori.crp.core;

/**
 * Base class of the errors raised while generating or filtering resonance structures.
 */
public class ResonanceException extends RuntimeException {

  /**
   * Constructs a {@code ResonanceException} with the specified detail message.
   *
   * @param message the detail message
   */
  public ResonanceException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code ResonanceException} with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause   the cause
   */
  public ResonanceException(String message, Throwable cause) {
    super(message, cause);
  }
}
