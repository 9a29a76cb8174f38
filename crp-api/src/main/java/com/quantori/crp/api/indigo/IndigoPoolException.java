package com.quantori.crp.api.indigo;

/**
 * Thrown when an Indigo instance cannot be leased in time or when the pool is handed back an instance it did not
 * lend.
 */
public class IndigoPoolException extends RuntimeException {

  /**
   * Constructs an {@code IndigoPoolException} with the specified detail message.
   *
   * @param message the detail message
   */
  public IndigoPoolException(String message) {
    super(message);
  }
}
