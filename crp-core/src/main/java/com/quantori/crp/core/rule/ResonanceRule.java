package com.quantori.crp.core.rule;

import com.quantori.crp.api.model.MolecularGraph;
import java.util.List;

/**
 * A pure rewrite: never mutates its argument and never throws for a chemically impossible edit, such candidates
 * are simply left out of the result.
 */
@FunctionalInterface
public interface ResonanceRule {

  List<MolecularGraph> apply(MolecularGraph graph);
}
