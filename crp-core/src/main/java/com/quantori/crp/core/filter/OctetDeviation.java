package com.quantori.crp.core.filter;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import lombok.experimental.UtilityClass;

/**
 * Sum over the heavy atoms of how far each one is from a filled valence shell. Carbon, nitrogen and oxygen aim at
 * an octet. Sulfur aims at an octet as well unless expanded octets are allowed, in which case a sulfur with at most
 * one lone pair may also settle on ten or twelve electrons.
 */
@UtilityClass
public class OctetDeviation {

  private static final double SULFUR_TRIPLE_BOND_PENALTY = 0.5;
  private static final double BIRADICAL_PENALTY = 3;

  public static double of(MolecularGraph graph, boolean allowExpandedOctet) {
    double deviation = 0;
    for (Atom atom : graph.getAtoms()) {
      if (atom.isHydrogen()) {
        continue;
      }
      int lonePairs = graph.getLonePairs(atom.getId());
      int radicals = atom.getRadicalElectrons();
      int valence = 2 * (graph.getTotalBondOrder(atom.getId()) + lonePairs) + radicals;
      Element element = atom.getElement();

      if (element == Element.C || element == Element.N || element == Element.O) {
        deviation += Math.abs(8 - valence);
      } else if (element == Element.S) {
        if (allowExpandedOctet && lonePairs <= 1) {
          deviation += Math.min(Math.abs(8 - valence), Math.min(Math.abs(10 - valence), Math.abs(12 - valence)));
        } else {
          deviation += Math.abs(8 - valence);
        }
        for (Bond bond : graph.getBondsOf(atom.getId())) {
          if (bond.isTriple() && graph.getAtom(bond.getOtherAtom(atom.getId())).getElement() == Element.S) {
            deviation += SULFUR_TRIPLE_BOND_PENALTY;
          }
        }
      }

      // a biradical site only counts when it stands in for a lone pair
      if (radicals >= 2 && (element == Element.N && lonePairs == 0
          || (element == Element.O || element == Element.S) && lonePairs <= 2)) {
        deviation += BIRADICAL_PENALTY;
      }
    }
    return deviation;
  }
}
