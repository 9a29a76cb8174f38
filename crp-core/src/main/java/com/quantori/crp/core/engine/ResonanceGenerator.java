package com.quantori.crp.core.engine;

import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.AromaticRingPerception;
import com.quantori.crp.api.perception.GraphIsomorphism;
import com.quantori.crp.api.validation.StructureValidator;
import com.quantori.crp.api.validation.ValidationResult;
import com.quantori.crp.core.InvalidStructureException;
import com.quantori.crp.core.aromatic.AromaticStructures;
import com.quantori.crp.core.filter.StructureFiltration;
import com.quantori.crp.core.rule.RuleKind;
import com.quantori.crp.core.rule.RuleTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of resonance structure generation. The seed is never modified and, unless filtration drops it in
 * favour of an isomorphic structure, comes first in the result.
 */
@Slf4j
public class ResonanceGenerator {

  private final ResonanceOptions options;
  private final RuleTable rules;
  private final ResonanceExpansion expansion;
  private final StructureFiltration filtration;

  public ResonanceGenerator() {
    this(ResonanceOptions.defaults());
  }

  public ResonanceGenerator(ResonanceOptions options) {
    this(options, new RuleTable());
  }

  public ResonanceGenerator(ResonanceOptions options, RuleTable rules) {
    this.options = options;
    this.rules = rules;
    this.expansion = new ResonanceExpansion(rules, options);
    this.filtration = new StructureFiltration(options.isAllowExpandedOctet());
  }

  /**
   * @return the representative resonance structures of {@code seed}, or every structure found when filtration is
   * switched off
   * @throws InvalidStructureException if the seed does not pass validation
   */
  public List<MolecularGraph> generate(MolecularGraph seed) {
    requireValid(seed);
    List<MolecularGraph> structures = new ArrayList<>(List.of(seed));
    MoleculeFeatures features = FeatureAnalyzer.analyze(seed);

    if (features.isAromatic() || features.isCyclic() && features.isRadical() && !features.isArylRadical()) {
      List<MolecularGraph> aromatic = optimalAromaticStructures(seed, features);
      if (aromatic.isEmpty()) {
        features = features.withAromatic(false).withPolycyclicAromatic(false);
      } else {
        int rings = AromaticRingPerception.findAromaticRings(aromatic.get(0)).size();
        features = features.withAromatic(true).withPolycyclicAromatic(rings > 1);
        for (MolecularGraph structure : aromatic) {
          if (!isDuplicate(seed, structure)) {
            structures.add(structure);
          }
        }
      }
    }
    log.debug("Seed features: {}", features);

    if (features.isAromatic()) {
      if (features.isRadical() && !features.isArylRadical()) {
        structures = expansion.expand(structures, List.of(RuleKind.KEKULE));
        structures = expansion.expand(structures, List.of(RuleKind.ALLYL_DELOCALIZATION));
      }
      RuleKind aromaticKind = features.isPolycyclicAromatic() && options.isClarStructures()
          ? RuleKind.CLAR
          : RuleKind.AROMATIC;
      structures = expansion.expand(structures, List.of(aromaticKind));
    }

    structures = expansion.expand(structures, RuleSelector.select(features));
    log.debug("{} resonance structures generated", structures.size());

    if (!options.isFilterStructures()) {
      return structures;
    }
    List<MolecularGraph> filtered = filtration.filter(structures, features);
    log.debug("{} representative structures kept", filtered.size());
    return filtered;
  }

  /**
   * Explores every path rewrite and the aryne shifts, ignoring the usual octet and charge windows, and keeps the
   * structures isomorphic to the seed.
   *
   * @return the seed followed by its isomorphic, non-identical resonance structures
   * @throws InvalidStructureException if the seed is disconnected or not valid
   */
  public List<MolecularGraph> generateIsomorphic(MolecularGraph seed) {
    if (!seed.isConnected()) {
      throw new InvalidStructureException("Isomorphic resonance structures need a connected seed, got "
          + seed.getComponentCount() + " fragments");
    }
    MolecularGraph start = seed.copy();
    List<Integer> addedHydrogens = options.isSaturateHydrogens() ? HydrogenSaturator.saturate(start) : List.of();
    requireValid(start);

    Set<RuleKind> kinds = EnumSet.noneOf(RuleKind.class);
    for (RuleKind kind : RuleKind.values()) {
      if (kind.isPathRule()) {
        kinds.add(kind);
      }
    }
    kinds.add(RuleKind.ARYNE);

    List<MolecularGraph> isomers = new ArrayList<>(List.of(start));
    List<MolecularGraph> isomorphic = new ArrayList<>();
    boolean capped = false;
    for (int index = 0; index < isomers.size() && !capped; index++) {
      MolecularGraph isomer = isomers.get(index);
      for (RuleKind kind : kinds) {
        for (MolecularGraph candidate : rules.apply(kind, isomer)) {
          if (isomers.stream().anyMatch(known -> GraphIsomorphism.isIdentical(known, candidate))) {
            continue;
          }
          if (options.getMaxStructures() > 0 && isomers.size() >= options.getMaxStructures()) {
            log.warn("Isomorphic resonance search stopped at {} structures", isomers.size());
            capped = true;
            break;
          }
          isomers.add(candidate);
          if (GraphIsomorphism.isIsomorphic(start, candidate)) {
            isomorphic.add(candidate);
          }
        }
        if (capped) {
          break;
        }
      }
    }

    List<MolecularGraph> result = new ArrayList<>();
    result.add(seed);
    for (MolecularGraph structure : isomorphic) {
      HydrogenSaturator.strip(structure, addedHydrogens);
      result.add(structure);
    }
    log.debug("{} isomorphic resonance structures out of {} explored", isomorphic.size(), isomers.size());
    return result;
  }

  /**
   * Rearranges the seed with aryne and allyl shifts into the forms with the most aromatic rings, and returns those
   * forms aromatized. Empty when the seed turns out not to be aromatic in any form.
   */
  List<MolecularGraph> optimalAromaticStructures(MolecularGraph seed, MoleculeFeatures features) {
    if (!features.isCyclic()) {
      return List.of();
    }
    List<RuleKind> kinds = new ArrayList<>(List.of(RuleKind.ARYNE));
    if (features.isRadical() && !features.isArylRadical()) {
      kinds.add(RuleKind.ALLYL_DELOCALIZATION);
    }
    List<MolecularGraph> kekule = expansion.expand(List.of(seed.copy()), kinds);

    Map<Integer, List<MolecularGraph>> byRingCount = new TreeMap<>(Comparator.reverseOrder());
    for (MolecularGraph structure : kekule) {
      int rings = AromaticRingPerception.findAromaticRings(structure).size();
      byRingCount.computeIfAbsent(rings, key -> new ArrayList<>()).add(structure);
    }

    List<MolecularGraph> aromatic = new ArrayList<>();
    for (List<MolecularGraph> group : byRingCount.values()) {
      for (MolecularGraph structure : group) {
        for (MolecularGraph candidate : AromaticStructures.aromatize(structure)) {
          if (aromatic.stream().noneMatch(known -> GraphIsomorphism.isIsomorphic(known, candidate))) {
            aromatic.add(candidate);
          }
        }
      }
      if (!aromatic.isEmpty()) {
        break;
      }
    }
    return aromatic;
  }

  private boolean isDuplicate(MolecularGraph seed, MolecularGraph structure) {
    return options.isKeepIsomorphic()
        ? GraphIsomorphism.isIdentical(seed, structure)
        : GraphIsomorphism.isIsomorphic(seed, structure);
  }

  private static void requireValid(MolecularGraph seed) {
    ValidationResult validation = StructureValidator.validate(seed);
    if (!validation.isValid()) {
      throw new InvalidStructureException(seed, validation.violations());
    }
  }
}
