package com.quantori.crp.core.filter;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.GraphDistances;
import com.quantori.crp.api.perception.GraphIsomorphism;
import com.quantori.crp.api.perception.Ring;
import com.quantori.crp.api.perception.RingPerception;
import com.quantori.crp.core.NoRepresentativeStructureException;
import com.quantori.crp.core.engine.MoleculeFeatures;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Keeps the representative structures of a resonance hybrid. Criteria, by decreasing importance:
 * <ol>
 *   <li>smallest deviation from the octet rule;</li>
 *   <li>smallest charge separation; one more separated pair is tolerated for radicals when it opens a new
 *   radical or multiple bond site;</li>
 *   <li>negative charges on the more electronegative atoms;</li>
 *   <li>opposite charges close together, like charges far apart;</li>
 *   <li>for aromatic species, aromatic structures over Kekulé ones.</li>
 * </ol>
 * The first structure of the input is the reference: it decides the multiplicity and is moved, or put back, to the
 * front of the result.
 */
@Slf4j
@RequiredArgsConstructor
public class StructureFiltration {

  private static final int OXONIUM_MAX_NEIGHBORS = 3;

  private final boolean allowExpandedOctet;

  public List<MolecularGraph> filter(List<MolecularGraph> structures, MoleculeFeatures features) {
    if (structures.isEmpty()) {
      throw new IllegalArgumentException("Nothing to filter");
    }
    MolecularGraph reference = structures.get(0);
    int radicals = reference.getRadicalCount();
    List<MolecularGraph> candidates = structures.stream()
        .filter(structure -> structure.getRadicalCount() == radicals)
        .toList();
    log.debug("{} of {} structures share the reference multiplicity", candidates.size(), structures.size());

    List<MolecularGraph> filtered = filterByOctet(candidates);
    log.debug("{} structures after octet filtration", filtered.size());
    filtered = filterByCharge(filtered);
    log.debug("{} structures after charge filtration", filtered.size());
    if (features != null && features.isAromatic()) {
      filtered = filterByAromaticity(filtered, features);
      log.debug("{} structures after aromaticity filtration", filtered.size());
    }
    if (filtered.isEmpty()) {
      throw new NoRepresentativeStructureException(reference);
    }
    return putReferenceFirst(filtered, reference);
  }

  List<MolecularGraph> filterByOctet(List<MolecularGraph> structures) {
    double[] deviations = structures.stream()
        .mapToDouble(structure -> OctetDeviation.of(structure, allowExpandedOctet))
        .toArray();
    double minimum = minimum(deviations);
    List<MolecularGraph> kept = new ArrayList<>();
    for (int i = 0; i < structures.size(); i++) {
      if (deviations[i] == minimum) {
        kept.add(structures.get(i));
      }
    }
    return kept;
  }

  List<MolecularGraph> filterByCharge(List<MolecularGraph> structures) {
    double[] spans = structures.stream().mapToDouble(ChargeSpan::of).toArray();
    double minimum = minimum(spans);
    boolean uniform = true;
    for (double span : spans) {
      uniform &= span == spans[0];
    }
    if (uniform && minimum == 0) {
      return structures;
    }

    List<MolecularGraph> minimal = new ArrayList<>();
    List<MolecularGraph> extraCharged = new ArrayList<>();
    for (int i = 0; i < structures.size(); i++) {
      if (spans[i] == minimum) {
        minimal.add(structures.get(i));
      } else if (spans[i] == minimum + 1) {
        extraCharged.add(structures.get(i));
      }
    }

    minimal = stabilizeByProximity(stabilizeByElectronegativity(minimal, false));
    if (!extraCharged.isEmpty() && structures.get(0).isRadical()) {
      Set<Integer> radicalSites = new HashSet<>();
      Set<Pair<Integer, Integer>> multipleBondSites = new HashSet<>();
      for (MolecularGraph structure : minimal) {
        collectSites(structure, radicalSites, multipleBondSites);
      }
      List<MolecularGraph> newSites = extraCharged.stream()
          .filter(structure -> hasNewSites(structure, radicalSites, multipleBondSites))
          .toList();
      extraCharged = stabilizeByProximity(stabilizeByElectronegativity(newSites, true));
    } else {
      extraCharged = List.of();
    }

    List<MolecularGraph> result = new ArrayList<>(minimal);
    result.addAll(extraCharged);
    return result;
  }

  /**
   * Drops structures carrying positive charge on more electronegative atoms than negative charge. Oxonium centres
   * (O+ with one to three neighbours and no fluorine) count as one extra unit of positive electronegativity.
   *
   * @param allowEmpty when false and every structure is rejected, the input is returned unchanged
   */
  List<MolecularGraph> stabilizeByElectronegativity(List<MolecularGraph> structures, boolean allowEmpty) {
    List<MolecularGraph> kept = new ArrayList<>();
    for (MolecularGraph structure : structures) {
      double positive = 0;
      double negative = 0;
      for (Atom atom : structure.getAtoms()) {
        double weight = atom.getElement().getElectronegativity() * Math.abs(atom.getCharge());
        if (atom.getCharge() > 0) {
          positive += weight;
          if (isOxonium(structure, atom)) {
            positive += 1;
          }
        } else if (atom.getCharge() < 0) {
          negative += weight;
        }
      }
      if (positive <= negative) {
        kept.add(structure);
      }
    }
    return kept.isEmpty() && !allowEmpty ? structures : kept;
  }

  /**
   * Keeps the structures with the smallest summed distance between opposite charges and, among those, the largest
   * summed distance between like charges. Distances count the atoms on the shortest path.
   */
  List<MolecularGraph> stabilizeByProximity(List<MolecularGraph> structures) {
    if (structures.isEmpty()) {
      return structures;
    }
    List<Pair<Integer, Integer>> distances = structures.stream().map(StructureFiltration::chargeDistances).toList();
    int closestOpposite = distances.stream().mapToInt(Pair::getLeft).min().orElse(0);
    int farthestAlike = distances.stream()
        .filter(distance -> distance.getLeft() == closestOpposite)
        .mapToInt(Pair::getRight)
        .max()
        .orElse(0);
    List<MolecularGraph> kept = new ArrayList<>();
    for (int i = 0; i < structures.size(); i++) {
      if (distances.get(i).getLeft() == closestOpposite && distances.get(i).getRight() == farthestAlike) {
        kept.add(structures.get(i));
      }
    }
    return kept;
  }

  List<MolecularGraph> filterByAromaticity(List<MolecularGraph> structures, MoleculeFeatures features) {
    List<MolecularGraph> kept = new ArrayList<>();
    for (MolecularGraph structure : structures) {
      if (structure.hasAromaticBonds()) {
        kept.add(structure);
      } else if (!features.isPolycyclicAromatic() && !hasKekuleRing(structure)) {
        kept.add(structure);
      }
    }
    return kept;
  }

  private static boolean hasKekuleRing(MolecularGraph structure) {
    for (Ring ring : RingPerception.findRings(structure)) {
      String orders = ring.getBondOrderCode(structure);
      if (ring.size() == 6 && ("SDSDSD".equals(orders) || "DSDSDS".equals(orders))) {
        return true;
      }
    }
    return false;
  }

  private static Pair<Integer, Integer> chargeDistances(MolecularGraph structure) {
    List<Integer> positive = new ArrayList<>();
    List<Integer> negative = new ArrayList<>();
    for (Atom atom : structure.getAtoms()) {
      if (atom.getCharge() > 0) {
        positive.add(atom.getId());
      } else if (atom.getCharge() < 0) {
        negative.add(atom.getId());
      }
    }
    if (positive.size() + negative.size() < 2) {
      return Pair.of(0, 0);
    }
    GraphDistances distances = new GraphDistances(structure);
    int opposite = 0;
    for (Integer plus : positive) {
      for (Integer minus : negative) {
        opposite += pathLength(distances, plus, minus);
      }
    }
    int alike = sumOfPairs(distances, positive) + sumOfPairs(distances, negative);
    return Pair.of(opposite, alike);
  }

  private static int sumOfPairs(GraphDistances distances, List<Integer> atoms) {
    int sum = 0;
    for (int i = 0; i < atoms.size(); i++) {
      for (int j = i + 1; j < atoms.size(); j++) {
        sum += pathLength(distances, atoms.get(i), atoms.get(j));
      }
    }
    return sum;
  }

  // disconnected atoms contribute nothing
  private static int pathLength(GraphDistances distances, int from, int to) {
    return Math.max(distances.atomDistance(from, to), 0);
  }

  private static boolean isOxonium(MolecularGraph structure, Atom atom) {
    if (atom.getElement() != Element.O || atom.getCharge() <= 0) {
      return false;
    }
    int degree = structure.getDegree(atom.getId());
    return degree >= 1 && degree <= OXONIUM_MAX_NEIGHBORS
        && structure.getNeighbors(atom.getId()).stream().noneMatch(neighbor -> neighbor.getElement() == Element.F);
  }

  private static void collectSites(MolecularGraph structure, Set<Integer> radicalSites,
                                   Set<Pair<Integer, Integer>> multipleBondSites) {
    for (Atom atom : structure.getAtoms()) {
      if (atom.isRadical()) {
        radicalSites.add(atom.getId());
      }
    }
    for (Bond bond : structure.getBonds()) {
      if (bond.isDouble() || bond.isTriple()) {
        multipleBondSites.add(site(bond));
      }
    }
  }

  private static boolean hasNewSites(MolecularGraph structure, Set<Integer> radicalSites,
                                     Set<Pair<Integer, Integer>> multipleBondSites) {
    for (Atom atom : structure.getAtoms()) {
      if (atom.isRadical() && !radicalSites.contains(atom.getId())) {
        return true;
      }
    }
    for (Bond bond : structure.getBonds()) {
      boolean sulfurPair = structure.getAtom(bond.getAtom1()).getElement() == Element.S
          && structure.getAtom(bond.getAtom2()).getElement() == Element.S;
      if ((bond.isDouble() || bond.isTriple()) && !multipleBondSites.contains(site(bond)) && !sulfurPair) {
        return true;
      }
    }
    return false;
  }

  private static Pair<Integer, Integer> site(Bond bond) {
    return Pair.of(Math.min(bond.getAtom1(), bond.getAtom2()), Math.max(bond.getAtom1(), bond.getAtom2()));
  }

  private static List<MolecularGraph> putReferenceFirst(List<MolecularGraph> filtered, MolecularGraph reference) {
    List<MolecularGraph> result = new ArrayList<>(filtered);
    Optional<MolecularGraph> match = filtered.stream()
        .filter(structure -> GraphIsomorphism.isIsomorphic(structure, reference))
        .findFirst();
    match.ifPresent(result::remove);
    result.add(0, match.orElse(reference));
    return result;
  }

  private static double minimum(double[] values) {
    double minimum = Double.MAX_VALUE;
    for (double value : values) {
      minimum = Math.min(minimum, value);
    }
    return minimum;
  }
}
