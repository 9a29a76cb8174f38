package com.quantori.crp.api.model;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Bond orders. Values are kept in half units so that aromatic bonds (1.5) sum exactly.
 */
@Getter
@RequiredArgsConstructor
public enum BondOrder {
  SINGLE(2, 'S'),
  DOUBLE(4, 'D'),
  TRIPLE(6, 'T'),
  AROMATIC(3, 'B');

  private final int halfUnits;
  private final char code;

  public double value() {
    return halfUnits / 2.0;
  }

  public boolean isAromatic() {
    return this == AROMATIC;
  }

  /**
   * Order one unit higher, empty for triple and aromatic bonds.
   */
  public Optional<BondOrder> increment() {
    switch (this) {
      case SINGLE:
        return Optional.of(DOUBLE);
      case DOUBLE:
        return Optional.of(TRIPLE);
      default:
        return Optional.empty();
    }
  }

  /**
   * Order one unit lower, empty for single and aromatic bonds.
   */
  public Optional<BondOrder> decrement() {
    switch (this) {
      case DOUBLE:
        return Optional.of(SINGLE);
      case TRIPLE:
        return Optional.of(DOUBLE);
      default:
        return Optional.empty();
    }
  }

  public static BondOrder ofCode(char code) {
    for (BondOrder order : values()) {
      if (order.code == code) {
        return order;
      }
    }
    throw new IllegalArgumentException("Unknown bond order code: " + code);
  }
}
