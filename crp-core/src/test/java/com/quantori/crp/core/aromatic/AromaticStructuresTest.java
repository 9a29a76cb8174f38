package com.quantori.crp.core.aromatic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.crp.api.model.Bond;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.GraphIsomorphism;
import com.quantori.crp.api.validation.StructureValidator;
import com.quantori.crp.core.Molecules;
import java.util.List;
import org.junit.jupiter.api.Test;

class AromaticStructuresTest {

  @Test
  void cumuleneBenzyneTurnsIntoAlkyne() {
    MolecularGraph cumulene = Molecules.cumuleneBenzyne();
    assertTrue(StructureValidator.isValid(cumulene));

    List<MolecularGraph> structures = AromaticStructures.aryne(cumulene);

    assertEquals(1, structures.size());
    MolecularGraph alkyne = structures.get(0);
    assertTrue(StructureValidator.isValid(alkyne));
    assertTrue(alkyne.findBond(1, 2).orElseThrow().isTriple());
    assertEquals(1, alkyne.getBonds().stream().filter(Bond::isTriple).count());
    assertEquals(2, alkyne.getBonds().stream().filter(Bond::isDouble).count());
  }

  @Test
  void alkyneTurnsBackIntoCumulene() {
    MolecularGraph cumulene = Molecules.cumuleneBenzyne();
    MolecularGraph alkyne = AromaticStructures.aryne(cumulene).get(0);

    List<MolecularGraph> structures = AromaticStructures.aryne(alkyne);

    assertEquals(1, structures.size());
    assertTrue(GraphIsomorphism.isIdentical(cumulene, structures.get(0)));
  }

  @Test
  void kekuleBenzeneHasNoAryneForm() {
    assertTrue(AromaticStructures.aryne(Molecules.kekuleBenzene()).isEmpty());
  }

  @Test
  void aromatizeKekuleBenzene() {
    MolecularGraph benzene = Molecules.kekuleBenzene();

    List<MolecularGraph> structures = AromaticStructures.aromatize(benzene);

    assertEquals(1, structures.size());
    assertEquals(6, structures.get(0).getBonds().stream().filter(Bond::isAromatic).count());
    assertEquals(0, benzene.getBonds().stream().filter(Bond::isAromatic).count());
  }

  @Test
  void nothingToAromatizeInAcyclicMolecule() {
    assertTrue(AromaticStructures.aromatize(Molecules.formamide()).isEmpty());
  }

  @Test
  void kekulizeAromaticBenzene() {
    List<MolecularGraph> structures = AromaticStructures.kekulize(Molecules.aromaticBenzene());

    assertEquals(1, structures.size());
    assertEquals(3, structures.get(0).getBonds().stream().filter(Bond::isDouble).count());
    assertTrue(AromaticStructures.kekulize(Molecules.kekuleBenzene()).isEmpty());
  }

  @Test
  void clarFallsBackToAromaticStructure() {
    ClarOptimizer failing = new ClarOptimizer() {
      @Override
      public List<MolecularGraph> generate(MolecularGraph graph) {
        throw new ClarOptimizationException("no solution");
      }
    };

    List<MolecularGraph> structures = AromaticStructures.clar(Molecules.kekuleBenzene(), failing);

    assertEquals(1, structures.size());
    assertTrue(structures.get(0).hasAromaticBonds());
    assertTrue(AromaticStructures.clar(Molecules.formamide(), failing).isEmpty());
  }
}
