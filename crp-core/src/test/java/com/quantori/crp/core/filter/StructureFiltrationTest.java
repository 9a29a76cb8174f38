package com.quantori.crp.core.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.GraphBuilder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.core.Molecules;
import com.quantori.crp.core.NoRepresentativeStructureException;
import com.quantori.crp.core.aromatic.AromaticStructures;
import com.quantori.crp.core.engine.MoleculeFeatures;
import com.quantori.crp.core.rule.GenerationRules;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StructureFiltrationTest {

  private static final MoleculeFeatures PLAIN = MoleculeFeatures.builder().build();

  private final StructureFiltration filtration = new StructureFiltration(true);

  @Test
  void hydrazoicAcidKeepsTwoOfThreeStructures() {
    MolecularGraph seed = Molecules.hydrazoicAcid();
    List<MolecularGraph> structures = new ArrayList<>(List.of(seed));
    structures.addAll(GenerationRules.lonePairMultipleBond(seed));
    assertEquals(3, structures.size());

    List<MolecularGraph> filtered = filtration.filter(structures, PLAIN);

    assertEquals(2, filtered.size());
    assertSame(seed, filtered.get(0));
    filtered.forEach(structure -> assertEquals(1.0, ChargeSpan.of(structure)));
  }

  @Test
  void formamideZwitterionIsFilteredOut() {
    MolecularGraph seed = Molecules.formamide();
    List<MolecularGraph> structures = new ArrayList<>(List.of(seed));
    structures.addAll(GenerationRules.lonePairMultipleBond(seed));

    assertThat(filtration.filter(structures, PLAIN)).containsExactly(seed);
  }

  @Test
  void extraChargeSeparationKeptForNewRadicalSite() {
    MolecularGraph seed = Molecules.nitrogenDioxide();
    List<MolecularGraph> structures = new ArrayList<>(List.of(seed));
    structures.addAll(GenerationRules.adjacentLonePairRadical(seed));

    List<MolecularGraph> filtered = filtration.filter(structures, PLAIN);

    assertEquals(2, filtered.size());
    assertSame(seed, filtered.get(0));
  }

  @Test
  void filteringIsIdempotent() {
    MolecularGraph seed = Molecules.hydrazoicAcid();
    List<MolecularGraph> structures = new ArrayList<>(List.of(seed));
    structures.addAll(GenerationRules.lonePairMultipleBond(seed));

    List<MolecularGraph> once = filtration.filter(structures, PLAIN);
    List<MolecularGraph> twice = filtration.filter(once, PLAIN);

    assertThat(twice).containsExactlyElementsOf(once);
  }

  @Test
  void rejectedReferenceIsPutBackInFront() {
    MolecularGraph formamide = Molecules.formamide();
    MolecularGraph carbocation = GenerationRules.adjacentLonePairMultipleBond(formamide).get(0);

    List<MolecularGraph> filtered = filtration.filter(List.of(carbocation, formamide), PLAIN);

    assertThat(filtered).containsExactly(carbocation, formamide);
  }

  @Test
  void differentMultiplicityIsDropped() {
    MolecularGraph methane = Molecules.methane();
    MolecularGraph methyl = GraphBuilder.create().atom(Element.C, 0, 1).hydrogens(0, 3).build();

    assertThat(filtration.filter(List.of(methane, methyl), PLAIN)).containsExactly(methane);
  }

  @Test
  void monocyclicAromaticDropsKekuleStructures() {
    MolecularGraph kekule = Molecules.kekuleBenzene();
    MolecularGraph aromatic = AromaticStructures.aromatize(kekule).get(0);
    MoleculeFeatures features = MoleculeFeatures.builder().cyclic(true).aromatic(true).build();

    assertThat(filtration.filter(List.of(aromatic, kekule), features)).containsExactly(aromatic);
  }

  @Test
  void polycyclicAromaticWithoutAromaticStructuresHasNoRepresentative() {
    MoleculeFeatures features = MoleculeFeatures.builder().cyclic(true).aromatic(true).polycyclicAromatic(true)
        .build();

    List<MolecularGraph> structures = List.of(Molecules.naphthalene(false));
    assertThrows(NoRepresentativeStructureException.class, () -> filtration.filter(structures, features));
  }

  @Test
  void positiveChargeOnOxygenViolatesElectronegativity() {
    MolecularGraph carbonMonoxide = GraphBuilder.create()
        .atom(Element.C, -1, 0)
        .atom(Element.O, 1, 0)
        .bond(0, 1, BondOrder.TRIPLE)
        .build();

    assertThat(filtration.stabilizeByElectronegativity(List.of(carbonMonoxide), false)).hasSize(1);
    assertThat(filtration.stabilizeByElectronegativity(List.of(carbonMonoxide), true)).isEmpty();
  }
}
