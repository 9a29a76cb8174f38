package com.quantori.crp.api.perception;

import com.quantori.crp.api.indigo.IndigoPerception;
import com.quantori.crp.api.model.MolecularGraph;
import lombok.experimental.UtilityClass;

@UtilityClass
public class Kekulizer {

  /**
   * Kekulizes the graph in place with Indigo's dearomatization. Unpaired electrons occupy a valence the way a
   * hydrogen would.
   *
   * @return false if no valid assignment exists, the graph is then left unchanged
   */
  public static boolean kekulize(MolecularGraph graph) {
    return IndigoPerception.shared().kekulize(graph);
  }
}
