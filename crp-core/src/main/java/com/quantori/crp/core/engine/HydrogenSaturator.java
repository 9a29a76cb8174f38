package com.quantori.crp.core.engine;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Completes heavy atoms with the hydrogens a structure drawn without them is missing, and takes them away again.
 */
@UtilityClass
public class HydrogenSaturator {

  /**
   * Adds hydrogens in place until every heavy atom reaches its usual valence for its charge.
   *
   * @return ids of the hydrogens added
   */
  public static List<Integer> saturate(MolecularGraph graph) {
    List<Integer> added = new ArrayList<>();
    for (Atom atom : new ArrayList<>(graph.getAtoms())) {
      if (atom.isHydrogen()) {
        continue;
      }
      int missing = usualValence(atom) - graph.getTotalBondOrder(atom.getId()) - atom.getRadicalElectrons();
      for (int i = 0; i < missing; i++) {
        Atom hydrogen = graph.addAtom(Element.H);
        graph.addBond(atom.getId(), hydrogen.getId(), BondOrder.SINGLE);
        added.add(hydrogen.getId());
      }
    }
    return added;
  }

  public static void strip(MolecularGraph graph, List<Integer> hydrogenIds) {
    hydrogenIds.forEach(graph::removeAtom);
  }

  static int usualValence(Atom atom) {
    Element element = atom.getElement();
    int charge = atom.getCharge();
    if (element == Element.C || element == Element.Si) {
      return 4 - Math.abs(charge);
    }
    if (element == Element.B) {
      return 3 - charge;
    }
    return 8 - element.getOuterElectrons() + charge;
  }
}
