package com.quantori.crp.core.aromatic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Maximization problem over 0/1 variables with nonnegative integer coefficients.
 */
@Getter
public class BinaryProgram {

  public enum Relation {
    EQUAL,
    LESS_OR_EQUAL
  }

  public record Constraint(int[] coefficients, Relation relation, int bound) {
  }

  private final int variableCount;
  private final int[] objective;
  private final List<Constraint> constraints = new ArrayList<>();
  private final Map<Integer, Integer> fixedValues = new HashMap<>();

  public BinaryProgram(int[] objective) {
    requireNonNegative(objective);
    this.variableCount = objective.length;
    this.objective = objective.clone();
  }

  public BinaryProgram addConstraint(int[] coefficients, Relation relation, int bound) {
    if (coefficients.length != variableCount) {
      throw new IllegalArgumentException(
          "Constraint has " + coefficients.length + " coefficients, expected " + variableCount);
    }
    requireNonNegative(coefficients);
    constraints.add(new Constraint(coefficients.clone(), relation, bound));
    return this;
  }

  public BinaryProgram fix(int variable, int value) {
    if (value != 0 && value != 1) {
      throw new IllegalArgumentException("Binary variable cannot take value " + value);
    }
    fixedValues.put(variable, value);
    return this;
  }

  public List<Constraint> getConstraints() {
    return Collections.unmodifiableList(constraints);
  }

  public int[] getObjective() {
    return objective.clone();
  }

  /**
   * Copy sharing nothing with this program, so that cuts can be added without touching the original.
   */
  public BinaryProgram copy() {
    BinaryProgram copy = new BinaryProgram(objective);
    constraints.forEach(c -> copy.addConstraint(c.coefficients(), c.relation(), c.bound()));
    copy.fixedValues.putAll(fixedValues);
    return copy;
  }

  private static void requireNonNegative(int[] values) {
    if (Arrays.stream(values).anyMatch(value -> value < 0)) {
      throw new IllegalArgumentException("Negative coefficients are not supported: " + Arrays.toString(values));
    }
  }
}
