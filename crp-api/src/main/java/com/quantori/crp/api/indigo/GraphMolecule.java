package com.quantori.crp.api.indigo;

import com.epam.indigo.Indigo;
import com.epam.indigo.IndigoObject;
import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An Indigo molecule written from a {@link MolecularGraph}. Remembers which graph atom and bond each Indigo index
 * stands for, so that answers from the toolkit can be read back in graph ids.
 */
final class GraphMolecule {

  static final int AROMATIC_BOND = 4;

  /**
   * How unpaired electrons are handed to Indigo.
   */
  enum Radicals {
    /**
     * As radicals, so that structures differing only in where an electron sits are told apart.
     */
    UNPAIRED,
    /**
     * As implicit hydrogens. A sigma radical such as the one of phenyl then neither breaks nor creates aromaticity,
     * and every unpaired electron counts as one occupied valence when double bonds are placed.
     */
    HYDROGENS
  }

  private final IndigoObject molecule;
  private final List<Integer> atomIds;
  private final List<Integer> bondIds;

  private GraphMolecule(IndigoObject molecule, List<Integer> atomIds, List<Integer> bondIds) {
    this.molecule = molecule;
    this.atomIds = atomIds;
    this.bondIds = bondIds;
  }

  static GraphMolecule write(Indigo indigo, MolecularGraph graph, Radicals radicals) {
    IndigoObject molecule = indigo.createMolecule();
    List<Integer> atomIds = new ArrayList<>();
    List<Integer> bondIds = new ArrayList<>();
    List<IndigoObject> indigoAtoms = new ArrayList<>();
    Map<Integer, Integer> indexOf = new HashMap<>();
    for (Atom atom : graph.getAtoms()) {
      IndigoObject indigoAtom = molecule.addAtom(atom.getElement().getSymbol());
      indigoAtom.setCharge(atom.getCharge());
      if (radicals == Radicals.HYDROGENS) {
        indigoAtom.setImplicitHCount(atom.getRadicalElectrons());
      } else {
        indigoAtom.setImplicitHCount(0);
        if (atom.getRadicalElectrons() > 0) {
          indigoAtom.setRadical(atom.getRadicalElectrons() == 1 ? Indigo.DOUBLET : Indigo.TRIPLET);
        }
      }
      indexOf.put(atom.getId(), indigoAtoms.size());
      indigoAtoms.add(indigoAtom);
      atomIds.add(atom.getId());
    }
    for (Bond bond : graph.getBonds()) {
      IndigoObject from = indigoAtoms.get(indexOf.get(bond.getAtom1()));
      IndigoObject to = indigoAtoms.get(indexOf.get(bond.getAtom2()));
      from.addBond(to, toIndigoOrder(bond.getOrder()));
      bondIds.add(bond.getId());
    }
    return new GraphMolecule(molecule, atomIds, bondIds);
  }

  static int toIndigoOrder(BondOrder order) {
    return order.isAromatic() ? AROMATIC_BOND : order.getHalfUnits() / 2;
  }

  /**
   * @throws StructureConversionException for orders the graph model has no counterpart for
   */
  static BondOrder toBondOrder(int indigoOrder) {
    switch (indigoOrder) {
      case 1:
        return BondOrder.SINGLE;
      case 2:
        return BondOrder.DOUBLE;
      case 3:
        return BondOrder.TRIPLE;
      case AROMATIC_BOND:
        return BondOrder.AROMATIC;
      default:
        throw new StructureConversionException("Unsupported bond order " + indigoOrder);
    }
  }

  IndigoObject molecule() {
    return molecule;
  }

  int atomId(IndigoObject indigoAtom) {
    return atomIds.get(indigoAtom.index());
  }

  int bondId(IndigoObject indigoBond) {
    return bondIds.get(indigoBond.index());
  }

  void dispose() {
    molecule.dispose();
  }
}
