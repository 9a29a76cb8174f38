package com.quantori.crp.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.GraphBuilder;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.GraphIsomorphism;
import com.quantori.crp.core.InvalidStructureException;
import com.quantori.crp.core.Molecules;
import com.quantori.crp.core.filter.OctetDeviation;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ResonanceGeneratorTest {

  private final ResonanceGenerator generator = new ResonanceGenerator();

  @Test
  void saturatedMoleculeHasOnlyItself() {
    MolecularGraph methane = Molecules.methane();

    List<MolecularGraph> structures = generator.generate(methane);

    assertEquals(1, structures.size());
    assertSame(methane, structures.get(0));
  }

  @Test
  void hydrazoicAcid() {
    MolecularGraph seed = Molecules.hydrazoicAcid();

    List<MolecularGraph> structures = generator.generate(seed);

    assertEquals(2, structures.size());
    assertSame(seed, structures.get(0));
    assertEquals(0, structures.get(1).getNetCharge());
  }

  @Test
  void formamideKeepsTheNeutralForm() {
    assertEquals(1, generator.generate(Molecules.formamide()).size());
    assertEquals(1, generator.generate(Molecules.formamideRelabeled()).size());
  }

  @Test
  void nitrogenDioxide() {
    assertEquals(2, generator.generate(Molecules.nitrogenDioxide()).size());
    assertEquals(2, generator.generate(Molecules.nitrogenDioxideRelabeled()).size());
  }

  @Test
  void kekuleBenzeneGainsItsAromaticForm() {
    MolecularGraph seed = Molecules.kekuleBenzene();

    List<MolecularGraph> structures = generator.generate(seed);

    assertEquals(2, structures.size());
    assertSame(seed, structures.get(0));
    assertEquals(6, structures.get(1).getBonds().stream().filter(Bond::isAromatic).count());
  }

  @Test
  void naphthaleneWithAndWithoutClarStructures() {
    assertEquals(1, generator.generate(Molecules.naphthalene(true)).size());

    ResonanceGenerator clar = new ResonanceGenerator(ResonanceOptions.builder().clarStructures(true).build());
    assertEquals(2, clar.generate(Molecules.naphthalene(true)).size());
  }

  static Stream<Arguments> relabeledSeeds() {
    ResonanceOptions clar = ResonanceOptions.builder().clarStructures(true).build();
    return Stream.of(
        Arguments.of("benzyl", Molecules.benzyl(), ResonanceOptions.builder().build()),
        Arguments.of("phenanthrene", Molecules.phenanthrene(), clar),
        Arguments.of("pyridine", Molecules.pyridine(), ResonanceOptions.builder().build()));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("relabeledSeeds")
  void atomOrderDoesNotChangeTheResult(String name, MolecularGraph seed, ResonanceOptions options) {
    ResonanceGenerator generator = new ResonanceGenerator(options);

    List<MolecularGraph> original = generator.generate(seed);
    List<MolecularGraph> relabeled = generator.generate(Molecules.relabeled(seed));

    assertEquals(original.size(), relabeled.size());
    assertThat(original).allSatisfy(structure -> assertThat(relabeled)
        .anyMatch(other -> GraphIsomorphism.isIsomorphic(structure, other)));
    assertThat(relabeled).allSatisfy(structure -> assertThat(original)
        .anyMatch(other -> GraphIsomorphism.isIsomorphic(structure, other)));
  }

  @Test
  void isomorphicSearchStopsAtTheCap() {
    ResonanceGenerator capped = new ResonanceGenerator(ResonanceOptions.builder().maxStructures(2).build());
    MolecularGraph seed = Molecules.nitroRadical();

    List<MolecularGraph> structures = capped.generateIsomorphic(seed);

    assertSame(seed, structures.get(0));
    assertThat(structures).hasSizeLessThanOrEqualTo(2);
  }

  @Test
  void invalidSeedIsRejected() {
    MolecularGraph pentavalentCarbon = GraphBuilder.create().atom(Element.C).hydrogens(0, 5).build();

    assertThrows(InvalidStructureException.class, () -> generator.generate(pentavalentCarbon));
  }

  @Test
  void seedIsNotModified() {
    MolecularGraph seed = Molecules.nitroRadical();
    String before = seed.toAdjacencyList();

    generator.generate(seed);
    generator.generateIsomorphic(seed);

    assertEquals(before, seed.toAdjacencyList());
  }

  @Test
  void unfilteredStructuresConserveAtomsAndCharge() {
    ResonanceGenerator unfiltered = new ResonanceGenerator(ResonanceOptions.builder().filterStructures(false).build());
    MolecularGraph seed = Molecules.nitroRadical();

    List<MolecularGraph> structures = unfiltered.generate(seed);

    assertThat(structures).hasSizeGreaterThan(1);
    assertThat(structures).allSatisfy(structure -> {
      assertEquals(seed.getAtomCount(), structure.getAtomCount());
      assertEquals(seed.getNetCharge(), structure.getNetCharge());
    });
  }

  @Test
  void keptStructuresShareTheLowestOctetDeviation() {
    List<MolecularGraph> structures = generator.generate(Molecules.sulfurDioxide());

    double lowest = structures.stream().mapToDouble(s -> OctetDeviation.of(s, true)).min().orElseThrow();
    assertThat(structures).allSatisfy(structure -> assertEquals(lowest, OctetDeviation.of(structure, true)));
  }

  @Test
  void isomorphicStructuresOfNitroRadical() {
    MolecularGraph seed = Molecules.nitroRadical();

    List<MolecularGraph> structures = generator.generateIsomorphic(seed);

    assertSame(seed, structures.get(0));
    assertThat(structures).hasSizeGreaterThanOrEqualTo(2);
    assertThat(structures).allSatisfy(structure -> assertTrue(GraphIsomorphism.isIsomorphic(seed, structure)));
  }

  @Test
  void isomorphicSearchNeedsConnectedSeed() {
    MolecularGraph fragments = GraphBuilder.create()
        .atom(Element.H).atom(Element.H).bond(0, 1, BondOrder.SINGLE)
        .atom(Element.H).atom(Element.H).bond(2, 3, BondOrder.SINGLE)
        .build();

    assertThrows(InvalidStructureException.class, () -> generator.generateIsomorphic(fragments));
  }

  @Test
  void addedHydrogensAreStrippedFromIsomorphicStructures() {
    ResonanceGenerator saturating = new ResonanceGenerator(ResonanceOptions.builder().saturateHydrogens(true).build());
    MolecularGraph skeleton = GraphBuilder.create()
        .atom(Element.O).atom(Element.C).atom(Element.N)
        .bond(0, 1, BondOrder.DOUBLE)
        .bond(1, 2, BondOrder.SINGLE)
        .build();

    List<MolecularGraph> structures = saturating.generateIsomorphic(skeleton);

    assertSame(skeleton, structures.get(0));
    assertThat(structures).allSatisfy(structure -> assertEquals(3, structure.getAtomCount()));
  }
}
