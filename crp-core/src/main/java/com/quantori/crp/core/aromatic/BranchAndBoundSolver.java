package com.quantori.crp.core.aromatic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/**
 * Exact branch and bound for {@link BinaryProgram}s over LP relaxations solved with the commons-math simplex.
 * Each node relaxes the open variables to {@code 0 <= x <= 1}; a node is cut when its relaxation is infeasible or
 * its rounded-down bound cannot beat the incumbent, and otherwise branches on the first fractional variable, one
 * before zero.
 */
@Slf4j
public class BranchAndBoundSolver {

  private static final double EPSILON = 1e-6;
  private static final int MAX_ITERATIONS = 10_000;

  public BinaryProgramSolution solve(BinaryProgram program) {
    if (program.getVariableCount() == 0) {
      return solveEmpty(program);
    }
    return new Search(program).run();
  }

  private static BinaryProgramSolution solveEmpty(BinaryProgram program) {
    for (BinaryProgram.Constraint constraint : program.getConstraints()) {
      boolean met = constraint.relation() == BinaryProgram.Relation.EQUAL
          ? constraint.bound() == 0
          : constraint.bound() >= 0;
      if (!met) {
        return BinaryProgramSolution.infeasible();
      }
    }
    return new BinaryProgramSolution(BinaryProgramSolution.Status.OPTIMAL, 0, new int[0]);
  }

  private static final class Search {

    private final int variableCount;
    private final int[] objective;
    private final LinearObjectiveFunction function;
    private final List<LinearConstraint> baseConstraints = new ArrayList<>();
    private final Integer[] fixed;
    private int[] best;
    private int bestObjective = -1;
    private int nodes;

    Search(BinaryProgram program) {
      this.variableCount = program.getVariableCount();
      this.objective = program.getObjective();
      this.function = new LinearObjectiveFunction(toDoubles(objective), 0);
      this.fixed = new Integer[variableCount];
      program.getFixedValues().forEach((variable, value) -> fixed[variable] = value);

      for (BinaryProgram.Constraint constraint : program.getConstraints()) {
        Relationship relationship = constraint.relation() == BinaryProgram.Relation.EQUAL
            ? Relationship.EQ
            : Relationship.LEQ;
        baseConstraints.add(new LinearConstraint(toDoubles(constraint.coefficients()), relationship,
            constraint.bound()));
      }
      for (int v = 0; v < variableCount; v++) {
        baseConstraints.add(new LinearConstraint(unit(v), Relationship.LEQ, 1));
      }
    }

    BinaryProgramSolution run() {
      branch();
      log.trace("Branch and bound explored {} nodes over {} variables", nodes, variableCount);
      if (best == null) {
        return BinaryProgramSolution.infeasible();
      }
      return new BinaryProgramSolution(BinaryProgramSolution.Status.OPTIMAL, bestObjective, best);
    }

    private void branch() {
      nodes++;
      PointValuePair relaxation = relax();
      if (relaxation == null || (int) Math.floor(relaxation.getValue() + EPSILON) <= bestObjective) {
        return;
      }
      double[] point = relaxation.getPoint();
      int fractional = firstFractional(point);
      if (fractional < 0) {
        accept(point);
        return;
      }
      for (int value = 1; value >= 0; value--) {
        fixed[fractional] = value;
        branch();
      }
      fixed[fractional] = null;
    }

    private PointValuePair relax() {
      Collection<LinearConstraint> constraints = new ArrayList<>(baseConstraints);
      for (int v = 0; v < variableCount; v++) {
        if (fixed[v] != null) {
          constraints.add(new LinearConstraint(unit(v), Relationship.EQ, fixed[v]));
        }
      }
      try {
        return new SimplexSolver().optimize(new MaxIter(MAX_ITERATIONS), function,
            new LinearConstraintSet(constraints), GoalType.MAXIMIZE, new NonNegativeConstraint(true),
            PivotSelectionRule.BLAND);
      } catch (NoFeasibleSolutionException e) {
        return null;
      } catch (TooManyIterationsException e) {
        throw new ClarOptimizationException("Simplex did not converge within " + MAX_ITERATIONS + " iterations", e);
      }
    }

    private int firstFractional(double[] point) {
      for (int v = 0; v < variableCount; v++) {
        if (Math.abs(point[v] - Math.rint(point[v])) > EPSILON) {
          return v;
        }
      }
      return -1;
    }

    private void accept(double[] point) {
      int[] values = new int[variableCount];
      int value = 0;
      for (int v = 0; v < variableCount; v++) {
        values[v] = (int) Math.rint(point[v]);
        value += objective[v] * values[v];
      }
      if (value > bestObjective) {
        bestObjective = value;
        best = values;
      }
    }

    private double[] unit(int variable) {
      double[] coefficients = new double[variableCount];
      coefficients[variable] = 1;
      return coefficients;
    }

    private static double[] toDoubles(int[] values) {
      double[] doubles = new double[values.length];
      for (int i = 0; i < values.length; i++) {
        doubles[i] = values[i];
      }
      return doubles;
    }
  }
}
