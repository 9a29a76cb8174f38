package com.quantori.crp.core.rule;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.validation.StructureValidator;
import com.quantori.crp.core.path.AdjacentPath;
import com.quantori.crp.core.path.AllylPath;
import com.quantori.crp.core.path.Direction;
import com.quantori.crp.core.path.DirectedPath;
import com.quantori.crp.core.path.PathFinder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Path driven resonance rewrites. Each site found by {@link PathFinder} is applied to a fresh copy; lone pair
 * counts are read before any bond or radical is touched.
 */
@UtilityClass
public class GenerationRules {

  public static List<MolecularGraph> allylDelocalization(MolecularGraph graph) {
    if (!graph.isRadical()) {
      return List.of();
    }
    List<MolecularGraph> structures = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      for (AllylPath path : PathFinder.findAllylDelocalizationPaths(graph, atom.getId())) {
        MolecularGraph structure = graph.copy();
        boolean applied = structure.getAtom(path.atom1()).decrementRadical()
            && increment(structure, path.bond12())
            && decrement(structure, path.bond23());
        structure.getAtom(path.atom3()).incrementRadical();
        accept(structure, applied).ifPresent(structures::add);
      }
    }
    return structures;
  }

  public static List<MolecularGraph> lonePairMultipleBond(MolecularGraph graph) {
    List<MolecularGraph> structures = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      for (AllylPath path : PathFinder.findLonePairMultipleBondPaths(graph, atom.getId())) {
        int lonePairs1 = graph.getLonePairs(path.atom1());
        int lonePairs3 = graph.getLonePairs(path.atom3());
        if (lonePairs1 <= 0) {
          continue;
        }
        MolecularGraph structure = graph.copy();
        boolean applied = increment(structure, path.bond12()) && decrement(structure, path.bond23());
        structure.updateCharge(path.atom1(), lonePairs1 - 1);
        structure.updateCharge(path.atom3(), lonePairs3 + 1);
        accept(structure, applied).ifPresent(structures::add);
      }
    }
    return structures;
  }

  public static List<MolecularGraph> adjacentLonePairRadical(MolecularGraph graph) {
    if (!graph.isRadical()) {
      return List.of();
    }
    List<MolecularGraph> structures = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      for (AdjacentPath path : PathFinder.findAdjacentLonePairRadicalPaths(graph, atom.getId())) {
        int lonePairs1 = graph.getLonePairs(path.atom1());
        int lonePairs2 = graph.getLonePairs(path.atom2());
        if (lonePairs2 <= 0) {
          continue;
        }
        MolecularGraph structure = graph.copy();
        boolean applied = structure.getAtom(path.atom1()).decrementRadical();
        structure.getAtom(path.atom2()).incrementRadical();
        structure.updateCharge(path.atom1(), lonePairs1 + 1);
        structure.updateCharge(path.atom2(), lonePairs2 - 1);
        accept(structure, applied).ifPresent(structures::add);
      }
    }
    return structures;
  }

  /**
   * Candidates whose net charge drifts away from the source are dropped.
   */
  public static List<MolecularGraph> adjacentLonePairMultipleBond(MolecularGraph graph) {
    List<MolecularGraph> structures = new ArrayList<>();
    int netCharge = graph.getNetCharge();
    for (Atom atom : graph.getAtoms()) {
      for (DirectedPath path : PathFinder.findAdjacentLonePairMultipleBondPaths(graph, atom.getId())) {
        int lonePairs1 = graph.getLonePairs(path.atom1());
        int lonePairs2 = graph.getLonePairs(path.atom2());
        MolecularGraph structure = graph.copy();
        boolean applied;
        if (path.direction() == Direction.GAIN_ORDER) {
          applied = increment(structure, path.bond12());
          structure.updateCharge(path.atom1(), lonePairs1 - 1);
        } else {
          applied = decrement(structure, path.bond12());
          structure.updateCharge(path.atom1(), lonePairs1 + 1);
        }
        structure.updateCharge(path.atom2(), lonePairs2);
        accept(structure, applied)
            .filter(candidate -> candidate.getNetCharge() == netCharge)
            .ifPresent(structures::add);
      }
    }
    return structures;
  }

  public static List<MolecularGraph> adjacentLonePairRadicalMultipleBond(MolecularGraph graph) {
    if (!graph.isRadical()) {
      return List.of();
    }
    List<MolecularGraph> structures = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      for (DirectedPath path : PathFinder.findAdjacentLonePairRadicalMultipleBondPaths(graph, atom.getId())) {
        int lonePairs1 = graph.getLonePairs(path.atom1());
        int lonePairs2 = graph.getLonePairs(path.atom2());
        MolecularGraph structure = graph.copy();
        Atom atom1 = structure.getAtom(path.atom1());
        Atom atom2 = structure.getAtom(path.atom2());
        boolean applied;
        if (path.direction() == Direction.GAIN_ORDER) {
          applied = increment(structure, path.bond12()) && atom2.decrementRadical();
          atom1.incrementRadical();
          structure.updateCharge(path.atom1(), lonePairs1 - 1);
        } else {
          applied = decrement(structure, path.bond12()) && atom1.decrementRadical();
          atom2.incrementRadical();
          structure.updateCharge(path.atom1(), lonePairs1 + 1);
        }
        structure.updateCharge(path.atom2(), lonePairs2);
        accept(structure, applied).ifPresent(structures::add);
      }
    }
    return structures;
  }

  public static List<MolecularGraph> n5dcRadical(MolecularGraph graph) {
    List<MolecularGraph> structures = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      for (AdjacentPath path : PathFinder.findN5dcRadicalPaths(graph, atom.getId())) {
        int lonePairs2 = graph.getLonePairs(path.atom1());
        int lonePairs3 = graph.getLonePairs(path.atom2());
        MolecularGraph structure = graph.copy();
        boolean applied = structure.getAtom(path.atom1()).decrementRadical();
        structure.getAtom(path.atom2()).incrementRadical();
        structure.updateCharge(path.atom1(), lonePairs2 + 1);
        structure.updateCharge(path.atom2(), lonePairs3 - 1);
        accept(structure, applied).ifPresent(structures::add);
      }
    }
    return structures;
  }

  private static boolean increment(MolecularGraph structure, int bondId) {
    return structure.getBond(bondId).incrementOrder();
  }

  private static boolean decrement(MolecularGraph structure, int bondId) {
    return structure.getBond(bondId).decrementOrder();
  }

  private static Optional<MolecularGraph> accept(MolecularGraph structure, boolean applied) {
    return Optional.of(structure)
        .filter(candidate -> applied)
        .filter(StructureValidator::isValid);
  }
}
