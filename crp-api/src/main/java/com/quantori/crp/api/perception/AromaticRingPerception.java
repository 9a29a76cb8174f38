package com.quantori.crp.api.perception;

import com.quantori.crp.api.indigo.IndigoPerception;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Perceives aromatic six-membered rings of carbon and nitrogen, as aromatized by Indigo's basic model. An exocyclic
 * double bond, as in a quinone, keeps a ring from being aromatic.
 */
@UtilityClass
public class AromaticRingPerception {

  public static List<Ring> findAromaticRings(MolecularGraph graph) {
    return IndigoPerception.shared().findAromaticRings(graph);
  }

  /**
   * Bond ids of all bonds lying in one of the given rings.
   */
  public static Set<Integer> getRingBondIds(List<Ring> rings) {
    Set<Integer> bondIds = new LinkedHashSet<>();
    rings.forEach(ring -> bondIds.addAll(ring.getBondIds()));
    return bondIds;
  }
}
