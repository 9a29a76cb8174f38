package com.quantori.crp.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Molecular graph exclusively owning its atoms and bonds. Atom and bond ids are stable: {@link #copy()} produces a
 * deep clone with identical ids, so a rewrite site found on one graph can be applied to its copy.
 * <p>
 * Lone pairs are derived: {@code (outer electrons - radicals - charge - floor(sum of bond orders)) / 2}, zero for
 * hydrogen.
 */
public class MolecularGraph {

  private final Map<Integer, Atom> atoms = new LinkedHashMap<>();
  private final Map<Integer, Bond> bonds = new LinkedHashMap<>();
  private final Map<Integer, List<Integer>> atomBonds = new LinkedHashMap<>();
  private int nextAtomId;
  private int nextBondId;

  public Atom addAtom(Element element) {
    return addAtom(element, 0, 0);
  }

  public Atom addAtom(Element element, int charge, int radicalElectrons) {
    Atom atom = new Atom(nextAtomId, element, charge, radicalElectrons);
    putAtom(atom);
    return atom;
  }

  public Bond addBond(int atom1, int atom2, BondOrder order) {
    getAtom(atom1);
    getAtom(atom2);
    if (findBond(atom1, atom2).isPresent()) {
      throw new IllegalArgumentException("Atoms " + atom1 + " and " + atom2 + " are already bonded");
    }
    Bond bond = new Bond(nextBondId, atom1, atom2, order);
    putBond(bond);
    return bond;
  }

  /**
   * Removes an atom together with its incident bonds.
   */
  public void removeAtom(int atomId) {
    for (Integer bondId : new ArrayList<>(atomBonds.getOrDefault(atomId, List.of()))) {
      removeBond(bondId);
    }
    atoms.remove(atomId);
    atomBonds.remove(atomId);
  }

  public void removeBond(int bondId) {
    Bond bond = bonds.remove(bondId);
    if (bond != null) {
      atomBonds.get(bond.getAtom1()).remove(Integer.valueOf(bondId));
      atomBonds.get(bond.getAtom2()).remove(Integer.valueOf(bondId));
    }
  }

  private void putAtom(Atom atom) {
    atoms.put(atom.getId(), atom);
    atomBonds.put(atom.getId(), new ArrayList<>());
    nextAtomId = Math.max(nextAtomId, atom.getId() + 1);
  }

  private void putBond(Bond bond) {
    bonds.put(bond.getId(), bond);
    atomBonds.get(bond.getAtom1()).add(bond.getId());
    atomBonds.get(bond.getAtom2()).add(bond.getId());
    nextBondId = Math.max(nextBondId, bond.getId() + 1);
  }

  public Atom getAtom(int atomId) {
    Atom atom = atoms.get(atomId);
    if (atom == null) {
      throw new IllegalArgumentException("No atom with id " + atomId);
    }
    return atom;
  }

  public Optional<Atom> findAtom(int atomId) {
    return Optional.ofNullable(atoms.get(atomId));
  }

  public Bond getBond(int bondId) {
    Bond bond = bonds.get(bondId);
    if (bond == null) {
      throw new IllegalArgumentException("No bond with id " + bondId);
    }
    return bond;
  }

  public Collection<Atom> getAtoms() {
    return Collections.unmodifiableCollection(atoms.values());
  }

  public Collection<Bond> getBonds() {
    return Collections.unmodifiableCollection(bonds.values());
  }

  public int getAtomCount() {
    return atoms.size();
  }

  public int getBondCount() {
    return bonds.size();
  }

  public Optional<Bond> findBond(int atom1, int atom2) {
    List<Integer> incident = atomBonds.get(atom1);
    if (incident == null) {
      return Optional.empty();
    }
    return incident.stream()
        .map(bonds::get)
        .filter(bond -> bond.contains(atom2))
        .findFirst();
  }

  public List<Bond> getBondsOf(int atomId) {
    getAtom(atomId);
    return atomBonds.get(atomId).stream().map(bonds::get).toList();
  }

  public List<Atom> getNeighbors(int atomId) {
    return getBondsOf(atomId).stream().map(bond -> atoms.get(bond.getOtherAtom(atomId))).toList();
  }

  public int getDegree(int atomId) {
    return atomBonds.get(atomId).size();
  }

  /**
   * Sum of incident bond orders in half units.
   */
  public int getBondOrderHalfUnits(int atomId) {
    return getBondsOf(atomId).stream().mapToInt(bond -> bond.getOrder().getHalfUnits()).sum();
  }

  /**
   * Sum of incident bond orders rounded down, so that an aromatic atom with three aromatic bonds counts four.
   */
  public int getTotalBondOrder(int atomId) {
    return getBondOrderHalfUnits(atomId) / 2;
  }

  /**
   * Twice the lone pair count, without any integrality check. Always zero for hydrogen.
   */
  public int getLonePairElectrons(int atomId) {
    Atom atom = getAtom(atomId);
    if (atom.isHydrogen()) {
      return 0;
    }
    return atom.getElement().getOuterElectrons() - atom.getRadicalElectrons() - atom.getCharge()
        - getTotalBondOrder(atomId);
  }

  /**
   * @throws IllegalStateException if the electron balance of the atom is odd
   */
  public int getLonePairs(int atomId) {
    int electrons = getLonePairElectrons(atomId);
    if (electrons % 2 != 0) {
      throw new IllegalStateException(
          "Atom " + atomId + " (" + getAtom(atomId).getElement().getSymbol() + ") has a non-integer lone pair count");
    }
    return electrons / 2;
  }

  /**
   * Valence electrons around an atom: bonding electrons, lone pair electrons and radicals.
   */
  public int getValenceElectrons(int atomId) {
    return 2 * getTotalBondOrder(atomId) + getLonePairElectrons(atomId) + getAtom(atomId).getRadicalElectrons();
  }

  /**
   * Sets the formal charge that corresponds to the given lone pair count.
   */
  public void updateCharge(int atomId, int lonePairs) {
    Atom atom = getAtom(atomId);
    atom.setCharge(atom.getElement().getOuterElectrons() - atom.getRadicalElectrons() - getTotalBondOrder(atomId)
        - 2 * lonePairs);
  }

  public int getNetCharge() {
    return atoms.values().stream().mapToInt(Atom::getCharge).sum();
  }

  public int getRadicalCount() {
    return atoms.values().stream().mapToInt(Atom::getRadicalElectrons).sum();
  }

  public boolean isRadical() {
    return getRadicalCount() > 0;
  }

  public boolean hasAromaticBonds() {
    return bonds.values().stream().anyMatch(Bond::isAromatic);
  }

  public int getComponentCount() {
    Set<Integer> visited = new HashSet<>();
    int components = 0;
    for (Integer start : atoms.keySet()) {
      if (visited.add(start)) {
        components++;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
          int current = queue.poll();
          for (Atom neighbor : getNeighbors(current)) {
            if (visited.add(neighbor.getId())) {
              queue.add(neighbor.getId());
            }
          }
        }
      }
    }
    return components;
  }

  public boolean isConnected() {
    return getComponentCount() <= 1;
  }

  public boolean isCyclic() {
    return bonds.size() - atoms.size() + getComponentCount() > 0;
  }

  /**
   * Deep copy preserving atom and bond ids.
   */
  public MolecularGraph copy() {
    MolecularGraph copy = new MolecularGraph();
    atoms.values().forEach(atom -> copy.putAtom(atom.copy()));
    bonds.values().forEach(bond -> copy.putBond(bond.copy()));
    copy.nextAtomId = nextAtomId;
    copy.nextBondId = nextBondId;
    return copy;
  }

  /**
   * Renders the graph in an adjacency list notation: one line per atom with its unpaired electrons, lone pairs,
   * charge and bonded neighbours.
   */
  public String toAdjacencyList() {
    StringBuilder builder = new StringBuilder();
    builder.append("multiplicity ").append(getRadicalCount() + 1).append('\n');
    for (Atom atom : atoms.values()) {
      int lonePairElectrons = getLonePairElectrons(atom.getId());
      String lonePairs = lonePairElectrons % 2 == 0 ? String.valueOf(lonePairElectrons / 2) : "?";
      builder.append(atom.getId()).append(' ')
          .append(atom.getElement().getSymbol())
          .append(" u").append(atom.getRadicalElectrons())
          .append(" p").append(lonePairs)
          .append(" c").append(atom.getCharge() > 0 ? "+" : "").append(atom.getCharge());
      String neighbors = getBondsOf(atom.getId()).stream()
          .sorted(Comparator.comparingInt(bond -> bond.getOtherAtom(atom.getId())))
          .map(bond -> "{" + bond.getOtherAtom(atom.getId()) + "," + bond.getOrder().getCode() + "}")
          .collect(Collectors.joining(" "));
      if (!neighbors.isEmpty()) {
        builder.append(' ').append(neighbors);
      }
      builder.append('\n');
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return "MolecularGraph{atoms=" + atoms.size() + ", bonds=" + bonds.size() + ", charge=" + getNetCharge()
        + ", radicals=" + getRadicalCount() + "}";
  }
}
