package com.quantori.crp.core.engine;

import com.quantori.crp.core.rule.RuleKind;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Chooses the path rewrites worth trying for a molecule.
 */
@UtilityClass
public class RuleSelector {

  public static Set<RuleKind> select(MoleculeFeatures features) {
    Set<RuleKind> kinds = new LinkedHashSet<>();
    if (features.isRadical() && !features.isAromatic() && !features.isArylRadical()) {
      kinds.add(RuleKind.ALLYL_DELOCALIZATION);
    }
    if (features.isCyclic()) {
      kinds.add(RuleKind.ARYNE);
    }
    if (features.isNitrogenValence5()) {
      kinds.add(RuleKind.N5DC_RADICAL);
    }
    if (features.isLonePairs()) {
      kinds.add(RuleKind.ADJACENT_LONE_PAIR_RADICAL);
      kinds.add(RuleKind.ADJACENT_LONE_PAIR_MULTIPLE_BOND);
      kinds.add(RuleKind.ADJACENT_LONE_PAIR_RADICAL_MULTIPLE_BOND);
      if (!features.isAromatic()) {
        kinds.add(RuleKind.LONE_PAIR_MULTIPLE_BOND);
      }
    }
    return kinds;
  }
}
