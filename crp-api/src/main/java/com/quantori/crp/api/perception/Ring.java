package com.quantori.crp.api.perception;

import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * A simple cycle of a molecular graph. Atoms are listed in walking order and bond {@code i} connects atom {@code i}
 * with atom {@code i + 1} (the last bond closes the ring).
 */
@Value
public class Ring {

  List<Integer> atomIds;
  List<Integer> bondIds;

  public Ring(List<Integer> atomIds, List<Integer> bondIds) {
    if (atomIds.size() != bondIds.size()) {
      throw new IllegalArgumentException("A ring needs as many bonds as atoms");
    }
    this.atomIds = List.copyOf(atomIds);
    this.bondIds = List.copyOf(bondIds);
  }

  /**
   * Walks a cycle given as an unordered set of bonds, starting from its smallest atom id towards the smaller of
   * that atom's two ring neighbours.
   *
   * @throws IllegalArgumentException if the bonds do not form a single simple cycle
   */
  public static Ring ofBonds(MolecularGraph graph, Collection<Integer> bondIds) {
    Map<Integer, List<Bond>> bondsAt = new HashMap<>();
    for (Integer bondId : bondIds) {
      Bond bond = graph.getBond(bondId);
      bondsAt.computeIfAbsent(bond.getAtom1(), atomId -> new ArrayList<>()).add(bond);
      bondsAt.computeIfAbsent(bond.getAtom2(), atomId -> new ArrayList<>()).add(bond);
    }
    if (bondsAt.size() != bondIds.size() || bondsAt.values().stream().anyMatch(bonds -> bonds.size() != 2)) {
      throw new IllegalArgumentException("Bonds " + bondIds + " do not form a simple cycle");
    }
    int start = bondsAt.keySet().stream().mapToInt(Integer::intValue).min().orElseThrow();
    List<Integer> atoms = new ArrayList<>();
    List<Integer> walked = new ArrayList<>();
    Bond next = bondsAt.get(start).stream()
        .min(Comparator.comparingInt(bond -> bond.getOtherAtom(start)))
        .orElseThrow();
    int current = start;
    while (atoms.size() < bondIds.size()) {
      atoms.add(current);
      walked.add(next.getId());
      int following = next.getOtherAtom(current);
      Bond previous = next;
      next = bondsAt.get(following).stream().filter(bond -> bond != previous).findFirst().orElseThrow();
      current = following;
    }
    return new Ring(atoms, walked);
  }

  public int size() {
    return atomIds.size();
  }

  public boolean containsAtom(int atomId) {
    return atomIds.contains(atomId);
  }

  public boolean containsBond(int bondId) {
    return bondIds.contains(bondId);
  }

  public int getAtomIdSum() {
    return atomIds.stream().mapToInt(Integer::intValue).sum();
  }

  /**
   * Bond orders around the ring as a string of order codes, e.g. {@code SDSDSD} for a Kekulé benzene.
   */
  public String getBondOrderCode(MolecularGraph graph) {
    return bondIds.stream()
        .map(bondId -> String.valueOf(graph.getBond(bondId).getOrder().getCode()))
        .collect(Collectors.joining());
  }
}
