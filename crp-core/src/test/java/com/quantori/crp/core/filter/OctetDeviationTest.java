package com.quantori.crp.core.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.GraphBuilder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.core.Molecules;
import org.junit.jupiter.api.Test;

class OctetDeviationTest {

  @Test
  void closedShellMoleculesObeyTheOctetRule() {
    assertEquals(0, OctetDeviation.of(Molecules.methane(), true));
    assertEquals(0, OctetDeviation.of(Molecules.formamide(), true));
    assertEquals(0, OctetDeviation.of(Molecules.hydrazoicAcid(), true));
  }

  @Test
  void unmarkedUnpairedElectronIsAnError() {
    MolecularGraph amidogen = GraphBuilder.create().atom(Element.N).hydrogens(0, 2).build();

    assertThrows(IllegalStateException.class, () -> OctetDeviation.of(amidogen, true));
  }

  @Test
  void radicalOxygenMissesOneElectron() {
    assertEquals(1, OctetDeviation.of(Molecules.nitrogenDioxide(), true));
  }

  @Test
  void sulfurDioxideDependsOnExpandedOctet() {
    MolecularGraph sulfurDioxide = Molecules.sulfurDioxide();

    assertEquals(0, OctetDeviation.of(sulfurDioxide, true));
    assertEquals(2, OctetDeviation.of(sulfurDioxide, false));
  }

  @Test
  void sulfurTripleBondIsPenalizedOnBothEnds() {
    MolecularGraph disulfur = GraphBuilder.create()
        .atom(Element.S)
        .atom(Element.S)
        .bond(0, 1, BondOrder.TRIPLE)
        .hydrogens(0, 1)
        .hydrogens(1, 1)
        .build();

    // each S: 4 bonds and one lone pair, 10 electrons
    assertEquals(1, OctetDeviation.of(disulfur, true));
  }

  @Test
  void biradicalOxygenIsPenalized() {
    MolecularGraph oxygenAtom = GraphBuilder.create().atom(Element.O, 0, 2).build();

    // 6 electrons plus the biradical penalty
    assertEquals(5, OctetDeviation.of(oxygenAtom, true));
  }
}
