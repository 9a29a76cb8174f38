package com.quantori.crp.core.rule;

/**
 * The closed set of resonance rewrites the engine knows about.
 */
public enum RuleKind {
  ALLYL_DELOCALIZATION,
  LONE_PAIR_MULTIPLE_BOND,
  ADJACENT_LONE_PAIR_RADICAL,
  ADJACENT_LONE_PAIR_MULTIPLE_BOND,
  ADJACENT_LONE_PAIR_RADICAL_MULTIPLE_BOND,
  N5DC_RADICAL,
  ARYNE,
  AROMATIC,
  KEKULE,
  CLAR;

  /**
   * Rewrites driven by a delocalization path rather than by ring perception.
   */
  public boolean isPathRule() {
    return ordinal() <= N5DC_RADICAL.ordinal();
  }
}
