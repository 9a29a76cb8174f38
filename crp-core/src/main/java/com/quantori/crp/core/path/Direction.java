package com.quantori.crp.core.path;

/**
 * Which way a bond order moves along a {@link DirectedPath}.
 */
public enum Direction {
  /**
   * atom1 donates a lone pair into the bond.
   */
  GAIN_ORDER,
  /**
   * The bond collapses into a lone pair on atom1.
   */
  LOSE_ORDER
}
