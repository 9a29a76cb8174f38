package com.quantori.crp.core;

import com.quantori.crp.api.model.MolecularGraph;

/**
 * Thrown when filtration rejects every generated structure.
 */
public class NoRepresentativeStructureException extends ResonanceException {

  public NoRepresentativeStructureException(MolecularGraph seed) {
    super(String.format("Could not determine representative localized structures for%n%s",
        seed.toAdjacencyList()));
  }
}
