package com.quantori.crp.api.indigo;

/**
 * Thrown when a structure cannot be converted between its text notation and a molecular graph.
 */
public class StructureConversionException extends RuntimeException {

  /**
   * Constructs a {@code StructureConversionException} with the specified detail message.
   *
   * @param message the detail message
   */
  public StructureConversionException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code StructureConversionException} with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause   the toolkit error
   */
  public StructureConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
