package com.quantori.crp.core.filter;

import com.quantori.crp.api.model.MolecularGraph;
import lombok.experimental.UtilityClass;

/**
 * Number of charge separated pairs beyond what the net charge requires: {@code (sum |q| - |net|) / 2}.
 */
@UtilityClass
public class ChargeSpan {

  public static double of(MolecularGraph graph) {
    int absoluteCharges = graph.getAtoms().stream().mapToInt(atom -> Math.abs(atom.getCharge())).sum();
    return (absoluteCharges - Math.abs(graph.getNetCharge())) / 2.0;
  }
}
