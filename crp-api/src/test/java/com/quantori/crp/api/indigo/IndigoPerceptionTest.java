package com.quantori.crp.api.indigo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.GraphBuilder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.Ring;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndigoPerceptionTest {

  private final IndigoProvider indigoProvider = new IndigoProvider(1, 5);
  private final IndigoPerception perception = new IndigoPerception(indigoProvider);

  private static GraphBuilder sixRing(Element first, BondOrder... orders) {
    GraphBuilder builder = GraphBuilder.create().atom(first);
    for (int i = 1; i < 6; i++) {
      builder.atom(Element.C);
    }
    for (int i = 0; i < 6; i++) {
      builder.bond(i, (i + 1) % 6, orders[i]);
    }
    for (int i = 1; i < 6; i++) {
      builder.hydrogens(i, 1);
    }
    return builder;
  }

  private static MolecularGraph pyridine() {
    return sixRing(Element.N, BondOrder.DOUBLE, BondOrder.SINGLE, BondOrder.DOUBLE, BondOrder.SINGLE,
        BondOrder.DOUBLE, BondOrder.SINGLE).build();
  }

  private static MolecularGraph phenyl(BondOrder order) {
    MolecularGraph phenyl = sixRing(Element.C, order, order, order, order, order, order).build();
    phenyl.getAtom(0).incrementRadical();
    return phenyl;
  }

  private static MolecularGraph propyl(int radicalCarbon) {
    MolecularGraph propyl = GraphBuilder.create()
        .atom(Element.C).atom(Element.C).atom(Element.C)
        .bond(0, 1).bond(1, 2)
        .hydrogens(0, radicalCarbon == 0 ? 2 : 3)
        .hydrogens(1, radicalCarbon == 1 ? 1 : 2)
        .hydrogens(2, 3)
        .build();
    propyl.getAtom(radicalCarbon).incrementRadical();
    return propyl;
  }

  private static MolecularGraph reversed(MolecularGraph graph) {
    MolecularGraph copy = new MolecularGraph();
    Map<Integer, Integer> ids = new HashMap<>();
    List<Atom> atoms = new ArrayList<>(graph.getAtoms());
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Atom atom = atoms.get(i);
      ids.put(atom.getId(), copy.addAtom(atom.getElement(), atom.getCharge(), atom.getRadicalElectrons()).getId());
    }
    for (Bond bond : graph.getBonds()) {
      copy.addBond(ids.get(bond.getAtom1()), ids.get(bond.getAtom2()), bond.getOrder());
    }
    return copy;
  }

  @Test
  void pyridineIsAromatic() {
    List<Ring> rings = perception.findAromaticRings(pyridine());

    assertThat(rings).hasSize(1);
    assertThat(rings.get(0).getAtomIds()).containsExactly(0, 1, 2, 3, 4, 5);
  }

  @Test
  void unpairedRingElectronDoesNotBreakAromaticity() {
    assertThat(perception.findAromaticRings(phenyl(BondOrder.AROMATIC))).hasSize(1);
  }

  @Test
  void radicalCarbonTakesPartInKekulization() {
    MolecularGraph phenyl = phenyl(BondOrder.AROMATIC);

    assertTrue(perception.kekulize(phenyl));

    assertEquals(3, phenyl.getBonds().stream().filter(Bond::isDouble).count());
    assertEquals(1, phenyl.getBondsOf(0).stream().filter(Bond::isDouble).count());
    assertFalse(phenyl.hasAromaticBonds());
  }

  @Test
  void radicalPositionDistinguishesStructures() {
    assertTrue(perception.isIsomorphic(propyl(0), propyl(0).copy()));
    assertFalse(perception.isIsomorphic(propyl(0), propyl(1)));
  }

  @Test
  void mappingFollowsTheHeteroatom() {
    MolecularGraph pyridine = pyridine();
    MolecularGraph relabeled = reversed(pyridine);

    Map<Integer, Integer> mapping = perception.findMapping(pyridine, relabeled).orElseThrow();

    assertEquals(Element.N, relabeled.getAtom(mapping.get(0)).getElement());
    assertEquals(6, mapping.size());
  }

  @Test
  void ringsAreReadInGraphIds() {
    MolecularGraph pyridine = reversed(pyridine());

    List<Ring> rings = perception.findRings(pyridine);

    assertThat(rings).hasSize(1);
    Ring ring = rings.get(0);
    for (int i = 0; i < ring.size(); i++) {
      int from = ring.getAtomIds().get(i);
      int to = ring.getAtomIds().get((i + 1) % ring.size());
      assertEquals(pyridine.findBond(from, to).orElseThrow().getId(), ring.getBondIds().get(i));
    }
  }

  @Test
  void sessionIsReturnedAfterEveryCall() {
    perception.isIsomorphic(pyridine(), reversed(pyridine()));
    perception.findAromaticRings(pyridine());
    perception.kekulize(phenyl(BondOrder.AROMATIC));

    assertEquals(1, indigoProvider.available());
  }
}
