package com.quantori.crp.core.engine;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Structural facts about a seed that decide which rewrites and filters apply to it.
 */
@Value
@With
@Builder
public class MoleculeFeatures {
  boolean radical;
  boolean cyclic;
  boolean aromatic;
  boolean polycyclicAromatic;
  /**
   * Every unpaired electron sits on an aromatic ring atom.
   */
  boolean arylRadical;
  /**
   * Some nitrogen has no lone pair left.
   */
  boolean nitrogenValence5;
  boolean lonePairs;
}
