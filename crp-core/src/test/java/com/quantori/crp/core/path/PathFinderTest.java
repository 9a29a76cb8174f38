package com.quantori.crp.core.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.core.Molecules;
import org.junit.jupiter.api.Test;

class PathFinderTest {

  @Test
  void amideNitrogenDonatesIntoCarbonyl() {
    MolecularGraph formamide = Molecules.formamide();

    assertThat(PathFinder.findLonePairMultipleBondPaths(formamide, 2))
        .containsExactly(new AllylPath(2, 1, 0, 1, 0));
    assertThat(PathFinder.findLonePairMultipleBondPaths(formamide, 1)).isEmpty();
  }

  @Test
  void carbonylOxygenCanMoveEitherWay() {
    MolecularGraph formamide = Molecules.formamide();

    assertThat(PathFinder.findAdjacentLonePairMultipleBondPaths(formamide, 0))
        .containsExactlyInAnyOrder(
            new DirectedPath(0, 1, 0, Direction.GAIN_ORDER),
            new DirectedPath(0, 1, 0, Direction.LOSE_ORDER));
    assertThat(PathFinder.findAdjacentLonePairMultipleBondPaths(formamide, 1)).isEmpty();
  }

  @Test
  void radicalOxygenNextToDoubleBond() {
    MolecularGraph nitrogenDioxide = Molecules.nitrogenDioxide();

    assertThat(PathFinder.findAllylDelocalizationPaths(nitrogenDioxide, 2))
        .containsExactly(new AllylPath(2, 1, 0, 1, 0));
    assertThat(PathFinder.findAllylDelocalizationPaths(nitrogenDioxide, 0)).isEmpty();
    assertThat(PathFinder.findAdjacentLonePairRadicalPaths(nitrogenDioxide, 2))
        .containsExactly(new AdjacentPath(2, 1));
  }

  @Test
  void closedShellMoleculeHasNoRadicalPaths() {
    MolecularGraph formamide = Molecules.formamide();

    for (int atom = 0; atom < 3; atom++) {
      assertThat(PathFinder.findAllylDelocalizationPaths(formamide, atom)).isEmpty();
      assertThat(PathFinder.findAdjacentLonePairRadicalPaths(formamide, atom)).isEmpty();
      assertThat(PathFinder.findAdjacentLonePairRadicalMultipleBondPaths(formamide, atom)).isEmpty();
    }
  }

  @Test
  void nitroRadicalSwapsRadicalAndCharge() {
    MolecularGraph nitro = Molecules.nitroRadical();

    assertTrue(PathFinder.isN5dc(nitro, 1));
    assertFalse(PathFinder.isN5dc(nitro, 0));
    assertThat(PathFinder.findN5dcRadicalPaths(nitro, 1)).containsExactly(new AdjacentPath(2, 3));
    assertThat(PathFinder.findN5dcRadicalPaths(nitro, 0)).isEmpty();
  }

  @Test
  void lonePairCapacities() {
    MolecularGraph formamide = Molecules.formamide();

    // O with two lone pairs, C with none, N with one
    assertTrue(PathFinder.isAbleToGainLonePair(formamide, 0));
    assertTrue(PathFinder.isAbleToLoseLonePair(formamide, 0));
    assertTrue(PathFinder.isAbleToGainLonePair(formamide, 1));
    assertFalse(PathFinder.isAbleToLoseLonePair(formamide, 1));
    assertTrue(PathFinder.isAbleToLoseLonePair(formamide, 2));
    assertEquals(1, PathFinder.lonePairs(formamide, 2));
  }
}
