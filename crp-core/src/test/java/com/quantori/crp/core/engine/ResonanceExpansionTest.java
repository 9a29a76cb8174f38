package com.quantori.crp.core.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.when;

import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.GraphBuilder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.core.Molecules;
import com.quantori.crp.core.rule.RuleKind;
import com.quantori.crp.core.rule.RuleTable;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ResonanceExpansionTest {

  private final ResonanceOptions options = ResonanceOptions.builder().build();

  @Test
  void closesOverRealRules() {
    ResonanceExpansion expansion = new ResonanceExpansion(new RuleTable(), options);
    MolecularGraph seed = Molecules.hydrazoicAcid();

    List<MolecularGraph> structures = expansion.expand(List.of(seed), List.of(RuleKind.LONE_PAIR_MULTIPLE_BOND));

    assertSame(seed, structures.get(0));
    assertEquals(3, structures.size());
  }

  @Test
  void duplicatesAreNotAppended() {
    RuleTable rules = Mockito.mock(RuleTable.class);
    MolecularGraph seed = Molecules.methane();
    when(rules.apply(eq(RuleKind.ALLYL_DELOCALIZATION), any())).thenReturn(List.of(Molecules.methane()));

    List<MolecularGraph> structures = new ResonanceExpansion(rules, options)
        .expand(List.of(seed), List.of(RuleKind.ALLYL_DELOCALIZATION));

    assertEquals(1, structures.size());
    Mockito.verify(rules, times(1)).apply(RuleKind.ALLYL_DELOCALIZATION, seed);
  }

  @Test
  void structuresWithAnotherNetChargeAreRemoved() {
    RuleTable rules = Mockito.mock(RuleTable.class);
    MolecularGraph seed = Molecules.methane();
    MolecularGraph hydroxide = GraphBuilder.create().atom(Element.O, -1, 0).hydrogens(0, 1).build();
    when(rules.apply(eq(RuleKind.KEKULE), same(seed))).thenReturn(List.of(hydroxide));

    List<MolecularGraph> structures = new ResonanceExpansion(rules, options)
        .expand(List.of(seed), List.of(RuleKind.KEKULE));

    assertEquals(List.of(seed), structures);
  }

  @Test
  void expansionStopsAtTheConfiguredCap() {
    RuleTable rules = Mockito.mock(RuleTable.class);
    // every call yields a structure with one more hydrogen molecule, so the closure never ends on its own
    when(rules.apply(eq(RuleKind.ARYNE), any())).thenAnswer(invocation -> {
      MolecularGraph graph = invocation.<MolecularGraph>getArgument(1).copy();
      int first = graph.addAtom(Element.H).getId();
      int second = graph.addAtom(Element.H).getId();
      graph.addBond(first, second, BondOrder.SINGLE);
      return List.of(graph);
    });
    ResonanceOptions capped = ResonanceOptions.builder().maxStructures(5).build();

    List<MolecularGraph> structures = new ResonanceExpansion(rules, capped)
        .expand(List.of(Molecules.methane()), List.of(RuleKind.ARYNE));

    assertEquals(5, structures.size());
  }

  @Test
  void structuresFarFromTheOctetMinimumAreNotExpanded() {
    RuleTable rules = Mockito.mock(RuleTable.class);
    MolecularGraph seed = Molecules.formamide();
    MolecularGraph oxygenAtom = GraphBuilder.create().atom(Element.O, 0, 2).build();
    when(rules.apply(eq(RuleKind.AROMATIC), same(seed))).thenReturn(List.of(oxygenAtom));

    List<MolecularGraph> structures = new ResonanceExpansion(rules, options)
        .expand(List.of(seed), List.of(RuleKind.AROMATIC));

    assertEquals(2, structures.size());
    Mockito.verify(rules, times(0)).apply(RuleKind.AROMATIC, oxygenAtom);
  }

  @Test
  void emptyWorklistIsRejected() {
    ResonanceExpansion expansion = new ResonanceExpansion(new RuleTable(), options);

    assertThrows(IllegalArgumentException.class, () -> expansion.expand(List.of(), List.of(RuleKind.KEKULE)));
  }
}
