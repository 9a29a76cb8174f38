package com.quantori.crp.api.perception;

import com.quantori.crp.api.indigo.IndigoPerception;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Ring perception through Indigo's smallest set of smallest rings.
 */
@UtilityClass
public class RingPerception {

  public static List<Ring> findRings(MolecularGraph graph) {
    return IndigoPerception.shared().findRings(graph);
  }
}
