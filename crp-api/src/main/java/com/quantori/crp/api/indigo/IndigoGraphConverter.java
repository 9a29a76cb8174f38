package com.quantori.crp.api.indigo;

import com.epam.indigo.Indigo;
import com.epam.indigo.IndigoException;
import com.epam.indigo.IndigoObject;
import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.BondOrder;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts between text notations understood by Indigo (SMILES, molfile) and {@link MolecularGraph}. Hydrogens are
 * always made explicit so that every hydrogen is an atom of the graph.
 */
@Slf4j
public class IndigoGraphConverter {

  private final IndigoProvider indigoProvider;

  public IndigoGraphConverter(IndigoProvider indigoProvider) {
    this.indigoProvider = indigoProvider;
  }

  /**
   * Loads a molecule from any notation Indigo autodetects.
   *
   * @throws StructureConversionException if the text cannot be parsed or holds an unsupported element
   */
  public MolecularGraph toGraph(String structure) {
    if (StringUtils.isBlank(structure)) {
      throw new StructureConversionException("Structure must not be blank");
    }
    return indigoProvider.withIndigo(indigo -> {
      IndigoObject molecule = load(indigo, structure);
      try {
        molecule.unfoldHydrogens();
        return readGraph(molecule, structure);
      } finally {
        dispose(molecule);
      }
    });
  }

  public String toSmiles(MolecularGraph graph) {
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule molecule = GraphMolecule.write(indigo, graph, GraphMolecule.Radicals.UNPAIRED);
      try {
        return molecule.molecule().smiles();
      } finally {
        molecule.dispose();
      }
    });
  }

  /**
   * Canonical SMILES with hydrogens folded, suitable as a structure key.
   */
  public String toCanonicalSmiles(MolecularGraph graph) {
    return indigoProvider.withIndigo(indigo -> {
      GraphMolecule molecule = GraphMolecule.write(indigo, graph, GraphMolecule.Radicals.UNPAIRED);
      try {
        molecule.molecule().foldHydrogens();
        return molecule.molecule().canonicalSmiles();
      } finally {
        molecule.dispose();
      }
    });
  }

  private static IndigoObject load(Indigo indigo, String structure) {
    try {
      return indigo.loadMolecule(structure);
    } catch (IndigoException e) {
      throw new StructureConversionException("Cannot load structure " + structure, e);
    }
  }

  private static MolecularGraph readGraph(IndigoObject molecule, String structure) {
    MolecularGraph graph = new MolecularGraph();
    Map<Integer, Integer> atomIds = new HashMap<>();
    for (IndigoObject indigoAtom : molecule.iterateAtoms()) {
      int atomicNumber = indigoAtom.atomicNumber();
      Element element = Element.ofAtomicNumber(atomicNumber)
          .orElseThrow(() -> new StructureConversionException(
              "Unsupported element with atomic number " + atomicNumber + " in " + structure));
      int charge = Objects.requireNonNullElse(indigoAtom.charge(), 0);
      Atom atom = graph.addAtom(element, charge, indigoAtom.radicalElectrons());
      atomIds.put(indigoAtom.index(), atom.getId());
    }
    for (IndigoObject indigoBond : molecule.iterateBonds()) {
      graph.addBond(atomIds.get(indigoBond.source().index()), atomIds.get(indigoBond.destination().index()),
          readOrder(indigoBond, structure));
    }
    restoreRadicals(graph);
    return graph;
  }

  private static BondOrder readOrder(IndigoObject indigoBond, String structure) {
    try {
      return GraphMolecule.toBondOrder(indigoBond.bondOrder());
    } catch (StructureConversionException e) {
      throw new StructureConversionException(e.getMessage() + " in " + structure, e);
    }
  }

  /**
   * Atoms left with an odd electron balance carry an unpaired electron the notation did not spell out.
   */
  private static void restoreRadicals(MolecularGraph graph) {
    for (Atom atom : graph.getAtoms()) {
      if (!atom.isHydrogen() && graph.getLonePairElectrons(atom.getId()) % 2 != 0) {
        log.debug("Assigning an unpaired electron to {}{}", atom.getElement().getSymbol(), atom.getId());
        atom.incrementRadical();
      }
    }
  }

  private static void dispose(IndigoObject indigoObject) {
    if (indigoObject != null) {
      indigoObject.dispose();
    }
  }
}
