package com.quantori.crp.core.aromatic;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.AromaticRingPerception;
import com.quantori.crp.api.perception.Ring;
import com.quantori.crp.api.validation.StructureValidator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the Clar structures of a polycyclic aromatic molecule: the Kekulé-like assignments with the largest number
 * of aromatic sextets (Hansen and Zheng, J. Math. Chem. 15, 1994).
 * <p>
 * The binary program has one sextet variable per aromatic ring followed by one double bond variable per
 * non-hydrogen bond touching a ring atom. Every ring atom is covered exactly once, either by a sextet or by a
 * double bond. Bonds leaving the ring system keep their current state.
 */
@Slf4j
@RequiredArgsConstructor
public class ClarOptimizer {

  private final BranchAndBoundSolver solver;

  public ClarOptimizer() {
    this(new BranchAndBoundSolver());
  }

  /**
   * @return one structure per optimal sextet assignment, empty when the best assignment has no sextet
   * @throws ClarOptimizationException if no assignment exists at all
   */
  public List<MolecularGraph> generate(MolecularGraph graph) {
    Layout layout = Layout.of(graph);
    if (layout.rings.isEmpty()) {
      throw new ClarOptimizationException("No aromatic rings to place sextets on");
    }
    List<MolecularGraph> structures = new ArrayList<>();
    for (int[] solution : optimize(layout)) {
      MolecularGraph structure = layout.apply(graph, solution);
      if (StructureValidator.isValid(structure)) {
        structures.add(structure);
      }
    }
    log.debug("{} Clar structures from {} aromatic rings", structures.size(), layout.rings.size());
    return structures;
  }

  private List<int[]> optimize(Layout layout) {
    List<int[]> solutions = new ArrayList<>();
    Deque<BinaryProgram> programs = new ArrayDeque<>();
    programs.push(layout.program());
    Integer maximum = null;
    while (!programs.isEmpty()) {
      BinaryProgram program = programs.pop();
      BinaryProgramSolution solution = solver.solve(program);
      if (maximum == null) {
        if (!solution.isOptimal()) {
          throw new ClarOptimizationException("Sextet assignment has no feasible solution");
        }
        if (solution.objective() == 0) {
          return List.of();
        }
        maximum = solution.objective();
      } else if (!solution.isOptimal() || solution.objective() < maximum) {
        break;
      }
      solutions.add(solution.values());
      programs.push(program.copy().addConstraint(layout.cut(solution.values()), BinaryProgram.Relation.LESS_OR_EQUAL,
          solution.objective() - 1));
    }
    return solutions;
  }

  private static final class Layout {

    private final List<Ring> rings;
    private final List<Integer> atoms;
    private final List<Bond> bonds;

    private Layout(List<Ring> rings, List<Integer> atoms, List<Bond> bonds) {
      this.rings = rings;
      this.atoms = atoms;
      this.bonds = bonds;
    }

    static Layout of(MolecularGraph graph) {
      List<Ring> rings = new ArrayList<>(AromaticRingPerception.findAromaticRings(graph));
      rings.sort(Comparator.comparingInt(Ring::getAtomIdSum));

      TreeSet<Integer> atoms = new TreeSet<>();
      rings.forEach(ring -> atoms.addAll(ring.getAtomIds()));

      List<Bond> bonds = new ArrayList<>();
      for (Integer atomId : atoms) {
        for (Bond bond : graph.getBondsOf(atomId)) {
          Atom other = graph.getAtom(bond.getOtherAtom(atomId));
          if (!other.isHydrogen() && !bonds.contains(bond)) {
            bonds.add(bond);
          }
        }
      }
      bonds.sort(Comparator.<Bond>comparingInt(bond -> Math.min(bond.getAtom1(), bond.getAtom2()))
          .thenComparingInt(bond -> Math.max(bond.getAtom1(), bond.getAtom2())));
      return new Layout(rings, new ArrayList<>(atoms), bonds);
    }

    BinaryProgram program() {
      int n = rings.size() + bonds.size();
      int[] objective = new int[n];
      for (int r = 0; r < rings.size(); r++) {
        objective[r] = 1;
      }
      BinaryProgram program = new BinaryProgram(objective);
      for (Integer atomId : atoms) {
        int[] row = new int[n];
        for (int r = 0; r < rings.size(); r++) {
          row[r] = rings.get(r).containsAtom(atomId) ? 1 : 0;
        }
        for (int b = 0; b < bonds.size(); b++) {
          row[rings.size() + b] = bonds.get(b).contains(atomId) ? 1 : 0;
        }
        program.addConstraint(row, BinaryProgram.Relation.EQUAL, 1);
      }
      for (int b = 0; b < bonds.size(); b++) {
        Bond bond = bonds.get(b);
        if (isExocyclic(bond)) {
          program.fix(rings.size() + b, bond.isDouble() ? 1 : 0);
        }
      }
      return program;
    }

    int[] cut(int[] solution) {
      int[] row = new int[solution.length];
      System.arraycopy(solution, 0, row, 0, rings.size());
      return row;
    }

    MolecularGraph apply(MolecularGraph graph, int[] solution) {
      MolecularGraph structure = graph.copy();
      for (int b = 0; b < bonds.size(); b++) {
        Bond bond = bonds.get(b);
        if (!isExocyclic(bond)) {
          BondOrder order = solution[rings.size() + b] == 1 ? BondOrder.DOUBLE : BondOrder.SINGLE;
          structure.getBond(bond.getId()).setOrder(order);
        }
      }
      for (int r = 0; r < rings.size(); r++) {
        if (solution[r] == 1) {
          rings.get(r).getBondIds().forEach(bondId -> structure.getBond(bondId).setOrder(BondOrder.AROMATIC));
        }
      }
      return structure;
    }

    private boolean isExocyclic(Bond bond) {
      return !atoms.contains(bond.getAtom1()) || !atoms.contains(bond.getAtom2());
    }
  }
}
