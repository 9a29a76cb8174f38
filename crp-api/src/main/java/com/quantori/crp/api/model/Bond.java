package com.quantori.crp.api.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@ToString
public class Bond {

  private final int id;
  private final int atom1;
  private final int atom2;
  @Setter
  private BondOrder order;

  public Bond(int id, int atom1, int atom2, BondOrder order) {
    if (atom1 == atom2) {
      throw new IllegalArgumentException("Bond " + id + " connects atom " + atom1 + " to itself");
    }
    this.id = id;
    this.atom1 = atom1;
    this.atom2 = atom2;
    this.order = order;
  }

  Bond copy() {
    return new Bond(id, atom1, atom2, order);
  }

  public boolean contains(int atomId) {
    return atom1 == atomId || atom2 == atomId;
  }

  public int getOtherAtom(int atomId) {
    if (atomId == atom1) {
      return atom2;
    }
    if (atomId == atom2) {
      return atom1;
    }
    throw new IllegalArgumentException("Atom " + atomId + " is not part of bond " + id);
  }

  public boolean isSingle() {
    return order == BondOrder.SINGLE;
  }

  public boolean isDouble() {
    return order == BondOrder.DOUBLE;
  }

  public boolean isTriple() {
    return order == BondOrder.TRIPLE;
  }

  public boolean isAromatic() {
    return order == BondOrder.AROMATIC;
  }

  /**
   * @return false if the order is triple or aromatic and cannot be increased
   */
  public boolean incrementOrder() {
    return order.increment().map(this::apply).orElse(false);
  }

  /**
   * @return false if the order is single or aromatic and cannot be decreased
   */
  public boolean decrementOrder() {
    return order.decrement().map(this::apply).orElse(false);
  }

  private boolean apply(BondOrder newOrder) {
    this.order = newOrder;
    return true;
  }
}
