package com.quantori.crp.core.rule;

import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.core.aromatic.AromaticStructures;
import com.quantori.crp.core.aromatic.ClarOptimizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every {@link RuleKind} to its rewrite.
 */
public class RuleTable {

  private final Map<RuleKind, ResonanceRule> rules = new EnumMap<>(RuleKind.class);

  public RuleTable() {
    this(new ClarOptimizer());
  }

  public RuleTable(ClarOptimizer clarOptimizer) {
    rules.put(RuleKind.ALLYL_DELOCALIZATION, GenerationRules::allylDelocalization);
    rules.put(RuleKind.LONE_PAIR_MULTIPLE_BOND, GenerationRules::lonePairMultipleBond);
    rules.put(RuleKind.ADJACENT_LONE_PAIR_RADICAL, GenerationRules::adjacentLonePairRadical);
    rules.put(RuleKind.ADJACENT_LONE_PAIR_MULTIPLE_BOND, GenerationRules::adjacentLonePairMultipleBond);
    rules.put(RuleKind.ADJACENT_LONE_PAIR_RADICAL_MULTIPLE_BOND,
        GenerationRules::adjacentLonePairRadicalMultipleBond);
    rules.put(RuleKind.N5DC_RADICAL, GenerationRules::n5dcRadical);
    rules.put(RuleKind.ARYNE, AromaticStructures::aryne);
    rules.put(RuleKind.AROMATIC, AromaticStructures::aromatize);
    rules.put(RuleKind.KEKULE, AromaticStructures::kekulize);
    rules.put(RuleKind.CLAR, graph -> AromaticStructures.clar(graph, clarOptimizer));
  }

  public ResonanceRule get(RuleKind kind) {
    return rules.get(kind);
  }

  public List<MolecularGraph> apply(RuleKind kind, MolecularGraph graph) {
    return get(kind).apply(graph);
  }
}
