package com.quantori.crp.core;

import com.quantori.crp.api.model.MolecularGraph;
import java.util.List;

/**
 * Thrown when a seed structure handed to the generator is not a chemically valid molecule.
 */
public class InvalidStructureException extends ResonanceException {

  public InvalidStructureException(String message) {
    super(message);
  }

  public InvalidStructureException(MolecularGraph graph, List<String> violations) {
    super(String.format("Invalid seed structure (%s):%n%s", String.join("; ", violations),
        graph.toAdjacencyList()));
  }
}
