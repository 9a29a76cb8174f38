package com.quantori.crp.core.aromatic;

import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.AromaticRingPerception;
import com.quantori.crp.api.perception.Kekulizer;
import com.quantori.crp.api.perception.Ring;
import com.quantori.crp.api.perception.RingPerception;
import com.quantori.crp.api.validation.StructureValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Ring based rewrites: aromatization, Kekulé assignment and the aryne shifts of six-membered rings.
 */
@Slf4j
@UtilityClass
public class AromaticStructures {

  private static final String ALKYNE = "TSDSDS";
  private static final String ALKYNE_TO_CUMULENE = "DDSDSD";
  private static final String CUMULENE = "DDDSDS";
  private static final String CUMULENE_TO_ALKYNE = "STSDSD";

  /**
   * Turns every perceived aromatic ring into aromatic bonds at once.
   *
   * @return the aromatic structure, or an empty list if no ring is aromatic or the result is not valid
   */
  public static List<MolecularGraph> aromatize(MolecularGraph graph) {
    List<Ring> rings = AromaticRingPerception.findAromaticRings(graph);
    if (rings.isEmpty()) {
      return List.of();
    }
    MolecularGraph structure = graph.copy();
    Set<Integer> bondIds = AromaticRingPerception.getRingBondIds(rings);
    bondIds.forEach(bondId -> structure.getBond(bondId).setOrder(BondOrder.AROMATIC));
    return StructureValidator.isValid(structure) ? List.of(structure) : List.of();
  }

  public static List<MolecularGraph> kekulize(MolecularGraph graph) {
    if (!graph.hasAromaticBonds()) {
      return List.of();
    }
    MolecularGraph structure = graph.copy();
    if (!Kekulizer.kekulize(structure) || !StructureValidator.isValid(structure)) {
      return List.of();
    }
    return List.of(structure);
  }

  /**
   * Alkyne and cumulene forms of six-membered rings: {@code TSDSDS -> DDSDSD} and {@code DDDSDS -> STSDSD}, read
   * from any rotation of the ring.
   */
  public static List<MolecularGraph> aryne(MolecularGraph graph) {
    List<MolecularGraph> structures = new ArrayList<>();
    for (Ring ring : RingPerception.findRings(graph)) {
      if (ring.size() != 6) {
        continue;
      }
      String orders = ring.getBondOrderCode(graph);
      String target;
      int shift;
      if (count(orders, 'T') == 1) {
        shift = orders.indexOf('T');
        target = ALKYNE.equals(rotate(orders, shift)) ? ALKYNE_TO_CUMULENE : null;
      } else if (count(orders, 'D') == 4) {
        shift = (orders + orders).indexOf("DDD");
        target = shift >= 0 && CUMULENE.equals(rotate(orders, shift)) ? CUMULENE_TO_ALKYNE : null;
      } else {
        continue;
      }
      if (target == null) {
        continue;
      }
      MolecularGraph structure = graph.copy();
      List<Integer> bondIds = ring.getBondIds();
      for (int i = 0; i < bondIds.size(); i++) {
        int bondId = bondIds.get((i + shift) % bondIds.size());
        structure.getBond(bondId).setOrder(BondOrder.ofCode(target.charAt(i)));
      }
      if (StructureValidator.isValid(structure)) {
        structures.add(structure);
      } else {
        log.debug("Aryne shift of ring {} to {} rejected", orders, target);
      }
    }
    return structures;
  }

  /**
   * Clar structures, or the plain aromatic structure when no sextet assignment exists.
   */
  public static List<MolecularGraph> clar(MolecularGraph graph, ClarOptimizer optimizer) {
    if (!graph.isCyclic()) {
      return List.of();
    }
    try {
      return optimizer.generate(graph);
    } catch (ClarOptimizationException e) {
      log.debug("Clar optimization failed, falling back to the aromatic structure: {}", e.getMessage());
      return aromatize(graph);
    }
  }

  private static String rotate(String orders, int shift) {
    return orders.substring(shift) + orders.substring(0, shift);
  }

  private static long count(String orders, char code) {
    return orders.chars().filter(c -> c == code).count();
  }
}
