package com.quantori.crp.core.aromatic;

public record BinaryProgramSolution(Status status, int objective, int[] values) {

  public enum Status {
    OPTIMAL,
    INFEASIBLE
  }

  public static BinaryProgramSolution infeasible() {
    return new BinaryProgramSolution(Status.INFEASIBLE, 0, new int[0]);
  }

  public boolean isOptimal() {
    return status == Status.OPTIMAL;
  }
}
