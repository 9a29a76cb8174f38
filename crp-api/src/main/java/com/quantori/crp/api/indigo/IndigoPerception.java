package com.quantori.crp.api.indigo;

import com.epam.indigo.IndigoException;
import com.epam.indigo.IndigoObject;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.Ring;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Structure perception answered by Indigo: exact matching, smallest set of smallest rings, aromaticity and
 * dearomatization. Every call writes the graph into a pooled session and reads the answer back in graph ids.
 */
@Slf4j
public class IndigoPerception {

  private static final String EXACT_MATCH_FLAGS = "ALL";
  private static final int AROMATIC_RING_SIZE = 6;
  private static final int SHARED_TIMEOUT_SECONDS = 60;

  private final IndigoProvider indigoProvider;

  public IndigoPerception(IndigoProvider indigoProvider) {
    this.indigoProvider = indigoProvider;
  }

  /**
   * Instance behind the static perception helpers, with one session per available processor.
   */
  public static IndigoPerception shared() {
    return Shared.INSTANCE;
  }

  public boolean isIsomorphic(MolecularGraph first, MolecularGraph second) {
    if (!sameSize(first, second)) {
      return false;
    }
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule query = GraphMolecule.write(indigo, first, GraphMolecule.Radicals.UNPAIRED);
      try {
        GraphMolecule target = GraphMolecule.write(indigo, second, GraphMolecule.Radicals.UNPAIRED);
        try {
          IndigoObject match = indigo.exactMatch(query.molecule(), target.molecule(), EXACT_MATCH_FLAGS);
          try {
            return match != null;
          } finally {
            dispose(match);
          }
        } finally {
          target.dispose();
        }
      } finally {
        query.dispose();
      }
    });
  }

  /**
   * Mapping of the non-hydrogen atom ids of the first graph onto the second, empty if the graphs do not match.
   * Hydrogens are interchangeable and left out.
   */
  public Optional<Map<Integer, Integer>> findMapping(MolecularGraph first, MolecularGraph second) {
    if (!sameSize(first, second)) {
      return Optional.empty();
    }
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule query = GraphMolecule.write(indigo, first, GraphMolecule.Radicals.UNPAIRED);
      try {
        GraphMolecule target = GraphMolecule.write(indigo, second, GraphMolecule.Radicals.UNPAIRED);
        try {
          IndigoObject match = indigo.exactMatch(query.molecule(), target.molecule(), EXACT_MATCH_FLAGS);
          try {
            return match == null ? Optional.empty() : Optional.of(readMapping(first, query, target, match));
          } finally {
            dispose(match);
          }
        } finally {
          target.dispose();
        }
      } finally {
        query.dispose();
      }
    });
  }

  /**
   * Smallest set of smallest rings, ordered by size and then by atom ids.
   */
  public List<Ring> findRings(MolecularGraph graph) {
    if (!graph.isCyclic()) {
      return List.of();
    }
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule molecule = GraphMolecule.write(indigo, graph, GraphMolecule.Radicals.UNPAIRED);
      try {
        return sorted(readRings(graph, molecule));
      } finally {
        molecule.dispose();
      }
    });
  }

  /**
   * Six-membered rings of carbon and nitrogen that Indigo aromatizes. Rings already drawn with aromatic bonds count
   * as well.
   */
  public List<Ring> findAromaticRings(MolecularGraph graph) {
    if (!graph.isCyclic()) {
      return List.of();
    }
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule molecule = GraphMolecule.write(indigo, graph, GraphMolecule.Radicals.HYDROGENS);
      try {
        molecule.molecule().aromatize();
        Map<Integer, Integer> indigoOrders = readOrders(molecule);
        List<Ring> aromatic = new ArrayList<>();
        for (Ring ring : readRings(graph, molecule)) {
          boolean carbonOrNitrogen = ring.getAtomIds().stream()
              .map(atomId -> graph.getAtom(atomId).getElement())
              .allMatch(element -> element == Element.C || element == Element.N);
          boolean aromatized = ring.getBondIds().stream()
              .allMatch(bondId -> indigoOrders.get(bondId) == GraphMolecule.AROMATIC_BOND);
          if (ring.size() == AROMATIC_RING_SIZE && carbonOrNitrogen && aromatized) {
            aromatic.add(ring);
          }
        }
        return sorted(aromatic);
      } finally {
        molecule.dispose();
      }
    });
  }

  /**
   * Replaces the aromatic bonds of the graph, in place, by the single and double bonds Indigo assigns.
   *
   * @return false if Indigo finds no assignment; the graph is then left unchanged
   */
  public boolean kekulize(MolecularGraph graph) {
    List<Bond> aromaticBonds = graph.getBonds().stream().filter(Bond::isAromatic).toList();
    if (aromaticBonds.isEmpty()) {
      return true;
    }
    Optional<Map<Integer, Integer>> orders = indigoProvider.withIndigo(indigo -> {
      GraphMolecule molecule = GraphMolecule.write(indigo, graph, GraphMolecule.Radicals.HYDROGENS);
      try {
        molecule.molecule().dearomatize();
        return Optional.of(readOrders(molecule));
      } catch (IndigoException e) {
        log.debug("Indigo could not dearomatize {}: {}", graph, e.getMessage());
        return Optional.<Map<Integer, Integer>>empty();
      } finally {
        molecule.dispose();
      }
    });
    if (orders.isEmpty()
        || aromaticBonds.stream().anyMatch(bond -> orders.get().get(bond.getId()) == GraphMolecule.AROMATIC_BOND)) {
      return false;
    }
    for (Bond bond : aromaticBonds) {
      bond.setOrder(GraphMolecule.toBondOrder(orders.get().get(bond.getId())));
    }
    return true;
  }

  private static boolean sameSize(MolecularGraph first, MolecularGraph second) {
    return first.getAtomCount() == second.getAtomCount() && first.getBondCount() == second.getBondCount();
  }

  private static Map<Integer, Integer> readMapping(MolecularGraph first, GraphMolecule query, GraphMolecule target,
                                                   IndigoObject match) {
    Map<Integer, Integer> mapping = new HashMap<>();
    for (IndigoObject atom : query.molecule().iterateAtoms()) {
      int atomId = query.atomId(atom);
      if (first.getAtom(atomId).isHydrogen()) {
        continue;
      }
      IndigoObject image = match.mapAtom(atom);
      if (image != null) {
        mapping.put(atomId, target.atomId(image));
      }
    }
    return Map.copyOf(mapping);
  }

  private static Map<Integer, Integer> readOrders(GraphMolecule molecule) {
    Map<Integer, Integer> orders = new HashMap<>();
    for (IndigoObject bond : molecule.molecule().iterateBonds()) {
      orders.put(molecule.bondId(bond), bond.bondOrder());
    }
    return orders;
  }

  private static List<Ring> readRings(MolecularGraph graph, GraphMolecule molecule) {
    List<Ring> rings = new ArrayList<>();
    for (IndigoObject ring : molecule.molecule().iterateSSSR()) {
      Set<Integer> bondIds = new LinkedHashSet<>();
      for (IndigoObject bond : ring.iterateBonds()) {
        bondIds.add(molecule.bondId(bond));
      }
      rings.add(Ring.ofBonds(graph, bondIds));
    }
    return rings;
  }

  private static List<Ring> sorted(List<Ring> rings) {
    return rings.stream()
        .sorted(Comparator.comparingInt(Ring::size).thenComparing(ring -> ring.getAtomIds().toString()))
        .toList();
  }

  private static void dispose(IndigoObject indigoObject) {
    if (indigoObject != null) {
      indigoObject.dispose();
    }
  }

  private static final class Shared {

    static final IndigoPerception INSTANCE = new IndigoPerception(
        new IndigoProvider(Runtime.getRuntime().availableProcessors(), SHARED_TIMEOUT_SECONDS));
  }
}
