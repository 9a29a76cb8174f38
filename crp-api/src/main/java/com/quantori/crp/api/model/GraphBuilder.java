package com.quantori.crp.api.model;

/**
 * Fluent helper assembling a {@link MolecularGraph}. Atoms receive consecutive ids starting from zero in the order
 * they are added.
 */
public final class GraphBuilder {

  private final MolecularGraph graph = new MolecularGraph();

  private GraphBuilder() {
  }

  public static GraphBuilder create() {
    return new GraphBuilder();
  }

  public GraphBuilder atom(Element element) {
    graph.addAtom(element);
    return this;
  }

  public GraphBuilder atom(Element element, int charge, int radicalElectrons) {
    graph.addAtom(element, charge, radicalElectrons);
    return this;
  }

  public GraphBuilder bond(int atom1, int atom2, BondOrder order) {
    graph.addBond(atom1, atom2, order);
    return this;
  }

  public GraphBuilder bond(int atom1, int atom2) {
    return bond(atom1, atom2, BondOrder.SINGLE);
  }

  /**
   * Adds {@code count} hydrogen atoms single bonded to the given atom.
   */
  public GraphBuilder hydrogens(int atomId, int count) {
    for (int i = 0; i < count; i++) {
      Atom hydrogen = graph.addAtom(Element.H);
      graph.addBond(atomId, hydrogen.getId(), BondOrder.SINGLE);
    }
    return this;
  }

  public MolecularGraph build() {
    return graph.copy();
  }
}
