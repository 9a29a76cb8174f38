package com.quantori.crp.api.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Atom of a {@link MolecularGraph}. The id is stable across copies of the graph; lone pairs are not stored
 * but derived from the element, charge, radicals and incident bond orders by the owning graph.
 */
@Getter
@ToString
public class Atom {

  private final int id;
  private final Element element;
  @Setter
  private int charge;
  private int radicalElectrons;

  public Atom(int id, Element element, int charge, int radicalElectrons) {
    if (radicalElectrons < 0) {
      throw new IllegalArgumentException("Negative radical electron count for atom " + id);
    }
    this.id = id;
    this.element = element;
    this.charge = charge;
    this.radicalElectrons = radicalElectrons;
  }

  Atom copy() {
    return new Atom(id, element, charge, radicalElectrons);
  }

  public boolean isHydrogen() {
    return element.isHydrogen();
  }

  public boolean isCarbon() {
    return element.isCarbon();
  }

  public boolean isRadical() {
    return radicalElectrons > 0;
  }

  public void incrementRadical() {
    radicalElectrons++;
  }

  /**
   * @return false if the atom has no radical electron to remove
   */
  public boolean decrementRadical() {
    if (radicalElectrons == 0) {
      return false;
    }
    radicalElectrons--;
    return true;
  }

  public void setRadicalElectrons(int radicalElectrons) {
    if (radicalElectrons < 0) {
      throw new IllegalArgumentException("Negative radical electron count for atom " + id);
    }
    this.radicalElectrons = radicalElectrons;
  }
}
