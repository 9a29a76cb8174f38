package com.quantori.crp.api.validation;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.Kekulizer;
import com.quantori.crp.api.perception.Ring;
import com.quantori.crp.api.perception.RingPerception;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Chemical sanity checks applied to every structure a rewrite produces. Problems are collected into a
 * {@link ValidationResult}, the validator never throws for an ill-formed structure.
 */
@UtilityClass
public class StructureValidator {

  private static final int MAX_ABSOLUTE_CHARGE = 3;

  public static boolean isValid(MolecularGraph graph) {
    return validate(graph).isValid();
  }

  public static ValidationResult validate(MolecularGraph graph) {
    List<String> violations = new ArrayList<>();
    for (Atom atom : graph.getAtoms()) {
      validateAtom(graph, atom, violations);
    }
    if (violations.isEmpty() && graph.hasAromaticBonds()) {
      validateAromaticity(graph, violations);
    }
    return violations.isEmpty() ? ValidationResult.valid() : new ValidationResult(violations);
  }

  private static void validateAtom(MolecularGraph graph, Atom atom, List<String> violations) {
    int id = atom.getId();
    String label = atom.getElement().getSymbol() + id;

    if (atom.isHydrogen() && graph.getDegree(id) > 1) {
      violations.add(label + " has more than one bond");
    }
    if (Math.abs(atom.getCharge()) > MAX_ABSOLUTE_CHARGE) {
      violations.add(label + " has charge " + atom.getCharge());
    }

    int lonePairElectrons = graph.getLonePairElectrons(id);
    if (lonePairElectrons < 0) {
      violations.add(label + " has a negative lone pair count");
      return;
    }
    if (lonePairElectrons % 2 != 0) {
      violations.add(label + " has a non-integer lone pair count");
      return;
    }
    if (lonePairElectrons / 2 > atom.getElement().getMaxLonePairs()) {
      violations.add(label + " has " + lonePairElectrons / 2 + " lone pairs");
    }
    if (graph.getValenceElectrons(id) > atom.getElement().getMaxValenceElectrons()) {
      violations.add(label + " has " + graph.getValenceElectrons(id) + " valence electrons");
    }

    long aromaticBonds = graph.getBondsOf(id).stream().filter(Bond::isAromatic).count();
    if (aromaticBonds == 1) {
      violations.add(label + " has a single aromatic bond");
    }
  }

  private static void validateAromaticity(MolecularGraph graph, List<String> violations) {
    List<Ring> aromaticRings = RingPerception.findRings(graph).stream()
        .filter(ring -> ring.getBondIds().stream().allMatch(bondId -> graph.getBond(bondId).isAromatic()))
        .toList();
    for (Bond bond : graph.getBonds()) {
      if (bond.isAromatic() && aromaticRings.stream().noneMatch(ring -> ring.containsBond(bond.getId()))) {
        violations.add("aromatic bond " + bond.getId() + " is not part of an aromatic ring");
      }
    }
    if (violations.isEmpty() && !Kekulizer.kekulize(graph.copy())) {
      violations.add("aromatic system cannot be kekulized");
    }
  }
}
