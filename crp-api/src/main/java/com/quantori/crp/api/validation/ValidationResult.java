package com.quantori.crp.api.validation;

import java.util.List;

/**
 * Outcome of a structure validation. An empty violation list means the structure is valid.
 */
public record ValidationResult(List<String> violations) {

  private static final ValidationResult VALID = new ValidationResult(List.of());

  public ValidationResult {
    violations = List.copyOf(violations);
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public boolean isValid() {
    return violations.isEmpty();
  }
}
