package com.quantori.crp.core.path;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Finds the sites a resonance rewrite can be applied to, starting from a single atom. Every method only reads the
 * graph; the returned ids stay valid on any copy of it.
 * <p>
 * Carbenes never donate a lone pair here, and oxygen is never left without one.
 */
@UtilityClass
public class PathFinder {

  /**
   * Radical {@code atom1} next to a multiple bond: {@code [.X]-X=X} or {@code [.X]=X#X}.
   */
  public static List<AllylPath> findAllylDelocalizationPaths(MolecularGraph graph, int atomId) {
    Atom atom1 = graph.getAtom(atomId);
    if (!atom1.isRadical()) {
      return List.of();
    }
    List<AllylPath> paths = new ArrayList<>();
    for (Bond bond12 : graph.getBondsOf(atomId)) {
      if (!bond12.isSingle() && !bond12.isDouble()) {
        continue;
      }
      int atom2 = bond12.getOtherAtom(atomId);
      for (Bond bond23 : graph.getBondsOf(atom2)) {
        int atom3 = bond23.getOtherAtom(atom2);
        if (atom3 != atomId && (bond23.isDouble() || bond23.isTriple())) {
          paths.add(new AllylPath(atomId, atom2, atom3, bond12.getId(), bond23.getId()));
        }
      }
    }
    return paths;
  }

  /**
   * Lone pair on {@code atom1} conjugated with a multiple bond two atoms away, e.g. {@code N#[N+][O-]} and
   * {@code [N-]=[N+]=O}.
   */
  public static List<AllylPath> findLonePairMultipleBondPaths(MolecularGraph graph, int atomId) {
    Atom atom1 = graph.getAtom(atomId);
    if (atom1.isCarbon() || lonePairs(graph, atomId) <= 0 || !isAbleToLoseLonePair(graph, atomId)) {
      return List.of();
    }
    List<AllylPath> paths = new ArrayList<>();
    for (Bond bond12 : graph.getBondsOf(atomId)) {
      int atom2 = bond12.getOtherAtom(atomId);
      boolean sulfurPair = is(atom1, Element.S) && is(graph.getAtom(atom2), Element.S);
      if (sulfurPair || !(bond12.isSingle() || bond12.isDouble())) {
        continue;
      }
      for (Bond bond23 : graph.getBondsOf(atom2)) {
        int atom3 = bond23.getOtherAtom(atom2);
        if (atom3 != atomId && (bond23.isDouble() || bond23.isTriple())
            && (graph.getAtom(atom3).isCarbon() || isAbleToGainLonePair(graph, atom3))) {
          paths.add(new AllylPath(atomId, atom2, atom3, bond12.getId(), bond23.getId()));
        }
      }
    }
    return paths;
  }

  /**
   * Radical {@code atom1} next to an atom carrying a lone pair, e.g. {@code R[NH][NH.] <=> R[NH.+][NH-]}. The bond
   * between the two sites may have any order.
   */
  public static List<AdjacentPath> findAdjacentLonePairRadicalPaths(MolecularGraph graph, int atomId) {
    Atom atom1 = graph.getAtom(atomId);
    int lonePairs1 = lonePairs(graph, atomId);
    boolean radicalSite = atom1.isRadical()
        && (atom1.isCarbon() && lonePairs1 == 0
        || is(atom1, Element.N) && between(lonePairs1, 0, 1)
        || is(atom1, Element.O) && between(lonePairs1, 1, 2)
        || is(atom1, Element.S) && between(lonePairs1, 0, 2));
    if (!radicalSite) {
      return List.of();
    }
    List<AdjacentPath> paths = new ArrayList<>();
    for (Atom atom2 : graph.getNeighbors(atomId)) {
      int lonePairs2 = lonePairs(graph, atom2.getId());
      if (atom2.isCarbon() && lonePairs2 == 1
          || is(atom2, Element.N) && between(lonePairs2, 1, 2)
          || is(atom2, Element.O) && between(lonePairs2, 2, 3) && !atom1.isCarbon() && !is(atom1, Element.O)
          || is(atom2, Element.S) && between(lonePairs2, 1, 3)) {
        paths.add(new AdjacentPath(atomId, atom2.getId()));
      }
    }
    return paths;
  }

  /**
   * Lone pair of {@code atom1} moving into or out of the bond to a neighbour, e.g.
   * {@code [NH-]-[CH2+] <=> [NH]=[CH2]}.
   */
  public static List<DirectedPath> findAdjacentLonePairMultipleBondPaths(MolecularGraph graph, int atomId) {
    Atom atom1 = graph.getAtom(atomId);
    if (atom1.isCarbon()) {
      return List.of();
    }
    List<DirectedPath> paths = new ArrayList<>();
    for (Bond bond12 : graph.getBondsOf(atomId)) {
      Atom atom2 = graph.getAtom(bond12.getOtherAtom(atomId));
      if (atom2.isHydrogen()) {
        continue;
      }
      boolean sulfurDoubleBond = is(atom1, Element.S) && is(atom2, Element.S) && bond12.isDouble();
      if ((bond12.isSingle() || bond12.isDouble()) && isAbleToLoseLonePair(graph, atomId) && !sulfurDoubleBond) {
        paths.add(new DirectedPath(atomId, atom2.getId(), bond12.getId(), Direction.GAIN_ORDER));
      }
      if ((bond12.isDouble() || bond12.isTriple()) && isAbleToGainLonePair(graph, atomId)) {
        paths.add(new DirectedPath(atomId, atom2.getId(), bond12.getId(), Direction.LOSE_ORDER));
      }
    }
    return paths;
  }

  /**
   * Like {@link #findAdjacentLonePairMultipleBondPaths} with a radical travelling the other way, e.g.
   * {@code [N]-[.CH2] <=> [N.]=[CH2]}.
   */
  public static List<DirectedPath> findAdjacentLonePairRadicalMultipleBondPaths(MolecularGraph graph,
                                                                                int atomId) {
    Atom atom1 = graph.getAtom(atomId);
    if (atom1.isCarbon()) {
      return List.of();
    }
    List<DirectedPath> paths = new ArrayList<>();
    for (Bond bond12 : graph.getBondsOf(atomId)) {
      Atom atom2 = graph.getAtom(bond12.getOtherAtom(atomId));
      if (atom2.isRadical() && (bond12.isSingle() || bond12.isDouble()) && isAbleToLoseLonePair(graph, atomId)) {
        paths.add(new DirectedPath(atomId, atom2.getId(), bond12.getId(), Direction.GAIN_ORDER));
      }
      if (atom1.isRadical() && (bond12.isDouble() || bond12.isTriple()) && isAbleToGainLonePair(graph, atomId)) {
        paths.add(new DirectedPath(atomId, atom2.getId(), bond12.getId(), Direction.LOSE_ORDER));
      }
    }
    return paths;
  }

  /**
   * Radical and negative charge swapping places around a pentavalent nitrogen, e.g.
   * {@code N=[N+]([O])[O-] <=> N=[N+]([O-])[O]}. Returns at most one path, holding the radical site first and the
   * anion second; empty unless {@code atomId} is such a nitrogen.
   */
  public static List<AdjacentPath> findN5dcRadicalPaths(MolecularGraph graph, int atomId) {
    if (!isN5dc(graph, atomId)) {
      return List.of();
    }
    for (Bond bond12 : graph.getBondsOf(atomId)) {
      Atom atom2 = graph.getAtom(bond12.getOtherAtom(atomId));
      if (!atom2.isRadical() || !bond12.isSingle() || atom2.getCharge() != 0
          || !isAbleToLoseLonePair(graph, atom2.getId())) {
        continue;
      }
      for (Bond bond13 : graph.getBondsOf(atomId)) {
        Atom atom3 = graph.getAtom(bond13.getOtherAtom(atomId));
        if (atom3.getId() != atom2.getId() && bond13.isSingle() && atom3.getCharge() < 0
            && isAbleToLoseLonePair(graph, atom3.getId())) {
          return List.of(new AdjacentPath(atom2.getId(), atom3.getId()));
        }
      }
    }
    return List.of();
  }

  /**
   * Cationic nitrogen with four bonding electron pairs spread over three neighbours.
   */
  public static boolean isN5dc(MolecularGraph graph, int atomId) {
    Atom atom = graph.getAtom(atomId);
    return is(atom, Element.N) && atom.getCharge() == 1 && !atom.isRadical() && graph.getDegree(atomId) == 3
        && lonePairs(graph, atomId) == 0;
  }

  public static boolean isAbleToGainLonePair(MolecularGraph graph, int atomId) {
    Atom atom = graph.getAtom(atomId);
    int lonePairs = lonePairs(graph, atomId);
    return (is(atom, Element.N) || is(atom, Element.S)) && between(lonePairs, 0, 2)
        || is(atom, Element.O) && between(lonePairs, 1, 2)
        || atom.isCarbon() && lonePairs == 0;
  }

  public static boolean isAbleToLoseLonePair(MolecularGraph graph, int atomId) {
    Atom atom = graph.getAtom(atomId);
    int lonePairs = lonePairs(graph, atomId);
    return (is(atom, Element.N) || is(atom, Element.S)) && between(lonePairs, 1, 3)
        || is(atom, Element.O) && between(lonePairs, 2, 3)
        || atom.isCarbon() && lonePairs == 1;
  }

  /**
   * Lone pair count, or -1 when the electron balance is odd or negative so that no predicate matches.
   */
  static int lonePairs(MolecularGraph graph, int atomId) {
    int electrons = graph.getLonePairElectrons(atomId);
    return electrons < 0 || electrons % 2 != 0 ? -1 : electrons / 2;
  }

  private static boolean is(Atom atom, Element element) {
    return atom.getElement() == element;
  }

  private static boolean between(int value, int low, int high) {
    return value >= low && value <= high;
  }
}
