package com.quantori.crp.api.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Elements supported by the resonance engine together with the tabulated properties the engine needs:
 * outer shell electrons, Pauling electronegativity, the maximum number of valence electrons around the atom
 * and the maximum number of lone pairs it may carry.
 */
@Getter
@RequiredArgsConstructor
public enum Element {
  H(1, "H", 1, 2.20, 2, 0),
  B(5, "B", 3, 2.04, 8, 1),
  C(6, "C", 4, 2.55, 8, 1),
  N(7, "N", 5, 3.04, 8, 3),
  O(8, "O", 6, 3.44, 8, 3),
  F(9, "F", 7, 3.98, 8, 4),
  Si(14, "Si", 4, 1.90, 8, 1),
  P(15, "P", 5, 2.19, 10, 3),
  S(16, "S", 6, 2.58, 12, 3),
  Cl(17, "Cl", 7, 3.16, 14, 4),
  Br(35, "Br", 7, 2.96, 14, 4),
  I(53, "I", 7, 2.66, 14, 4);

  private static final Map<Integer, Element> BY_ATOMIC_NUMBER = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(Element::getAtomicNumber, Function.identity()));

  private static final Map<String, Element> BY_SYMBOL = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(Element::getSymbol, Function.identity()));

  private final int atomicNumber;
  private final String symbol;
  private final int outerElectrons;
  private final double electronegativity;
  private final int maxValenceElectrons;
  private final int maxLonePairs;

  public static Optional<Element> ofAtomicNumber(int atomicNumber) {
    return Optional.ofNullable(BY_ATOMIC_NUMBER.get(atomicNumber));
  }

  public static Optional<Element> ofSymbol(String symbol) {
    return Optional.ofNullable(BY_SYMBOL.get(symbol));
  }

  public boolean isHydrogen() {
    return this == H;
  }

  public boolean isCarbon() {
    return this == C;
  }
}
