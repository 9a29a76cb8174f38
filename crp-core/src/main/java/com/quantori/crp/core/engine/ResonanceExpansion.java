package com.quantori.crp.core.engine;

import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.GraphIsomorphism;
import com.quantori.crp.core.filter.ChargeSpan;
import com.quantori.crp.core.filter.OctetDeviation;
import com.quantori.crp.core.rule.RuleKind;
import com.quantori.crp.core.rule.RuleTable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Breadth first closure of a structure list under a set of rewrites.
 * <p>
 * Only structures close to the best seen so far are expanded: octet deviation within two of the minimum and
 * charge span within one of the minimum. Both minima start from the initial list and only ever tighten. New
 * structures are appended unless an isomorphic one (an identical one with {@code keepIsomorphic}) is already
 * present.
 */
@Slf4j
@RequiredArgsConstructor
public class ResonanceExpansion {

  private static final double OCTET_WINDOW = 2;
  private static final double CHARGE_SPAN_WINDOW = 1;

  private final RuleTable rules;
  private final ResonanceOptions options;

  /**
   * @param worklist non-empty list of structures, the first one is the reference for the net charge
   * @return a new list starting with the given structures
   */
  public List<MolecularGraph> expand(List<MolecularGraph> worklist, Collection<RuleKind> kinds) {
    if (worklist.isEmpty()) {
      throw new IllegalArgumentException("Expansion needs at least one structure");
    }
    List<MolecularGraph> structures = new ArrayList<>(worklist);
    double minOctet = structures.stream().mapToDouble(this::octetDeviation).min().orElseThrow();
    double minSpan = structures.stream().mapToDouble(ChargeSpan::of).min().orElseThrow();
    boolean capped = false;

    for (int index = 0; index < structures.size() && !capped; index++) {
      MolecularGraph structure = structures.get(index);
      double octet = octetDeviation(structure);
      double span = ChargeSpan.of(structure);
      if (octet > minOctet + OCTET_WINDOW || span > minSpan + CHARGE_SPAN_WINDOW) {
        continue;
      }
      minOctet = Math.min(minOctet, octet);
      minSpan = Math.min(minSpan, span);

      for (RuleKind kind : kinds) {
        for (MolecularGraph candidate : rules.apply(kind, structure)) {
          if (isKnown(structures, candidate)) {
            continue;
          }
          if (options.getMaxStructures() > 0 && structures.size() >= options.getMaxStructures()) {
            log.warn("Resonance expansion stopped at {} structures", structures.size());
            capped = true;
            break;
          }
          structures.add(candidate);
        }
        if (capped) {
          break;
        }
      }
    }
    return removeChargeMismatches(structures);
  }

  private List<MolecularGraph> removeChargeMismatches(List<MolecularGraph> structures) {
    int charge = structures.get(0).getNetCharge();
    List<MolecularGraph> kept = new ArrayList<>(structures.size());
    kept.add(structures.get(0));
    for (MolecularGraph structure : structures.subList(1, structures.size())) {
      if (structure.getNetCharge() == charge) {
        kept.add(structure);
      } else {
        log.warn("Removing structure with net charge {} from resonance structures of net charge {}:\n{}",
            structure.getNetCharge(), charge, structure.toAdjacencyList());
      }
    }
    return kept;
  }

  private boolean isKnown(List<MolecularGraph> structures, MolecularGraph candidate) {
    for (MolecularGraph structure : structures) {
      boolean same = options.isKeepIsomorphic()
          ? GraphIsomorphism.isIdentical(structure, candidate)
          : GraphIsomorphism.isIsomorphic(structure, candidate);
      if (same) {
        return true;
      }
    }
    return false;
  }

  private double octetDeviation(MolecularGraph structure) {
    return OctetDeviation.of(structure, options.isAllowExpandedOctet());
  }
}
