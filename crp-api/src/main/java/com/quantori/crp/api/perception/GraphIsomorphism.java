package com.quantori.crp.api.perception;

import com.quantori.crp.api.indigo.IndigoPerception;
import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.Map;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Structure comparison. Isomorphism is decided by Indigo's exact match on element, charge, radicals and bond
 * orders; identity is a plain id by id comparison.
 */
@UtilityClass
public class GraphIsomorphism {

  public static boolean isIsomorphic(MolecularGraph first, MolecularGraph second) {
    return IndigoPerception.shared().isIsomorphic(first, second);
  }

  /**
   * Mapping of non-hydrogen atom ids from the first graph onto the second, empty if the graphs are not isomorphic.
   */
  public static Optional<Map<Integer, Integer>> findMapping(MolecularGraph first, MolecularGraph second) {
    return IndigoPerception.shared().findMapping(first, second);
  }

  /**
   * Stricter than isomorphism: same atom ids carrying the same labels and the same bonds between the same ids.
   */
  public static boolean isIdentical(MolecularGraph first, MolecularGraph second) {
    if (first.getAtomCount() != second.getAtomCount() || first.getBondCount() != second.getBondCount()) {
      return false;
    }
    for (Atom atom : first.getAtoms()) {
      Optional<Atom> other = second.findAtom(atom.getId());
      if (other.isEmpty() || !sameLabel(atom, other.get())) {
        return false;
      }
    }
    for (Bond bond : first.getBonds()) {
      Optional<Bond> other = second.findBond(bond.getAtom1(), bond.getAtom2());
      if (other.isEmpty() || other.get().getOrder() != bond.getOrder()) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameLabel(Atom atom, Atom other) {
    return atom.getElement() == other.getElement() && atom.getCharge() == other.getCharge()
        && atom.getRadicalElectrons() == other.getRadicalElectrons();
  }
}
