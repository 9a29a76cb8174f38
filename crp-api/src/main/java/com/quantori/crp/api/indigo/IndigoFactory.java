package com.quantori.crp.api.indigo;

import com.epam.indigo.Indigo;
import lombok.experimental.UtilityClass;

/**
 * Opens Indigo sessions set up for molecular graphs with explicit hydrogens: valences are never rejected because the
 * graphs carry charges and radicals the toolkit's valence tables do not expect, and aromaticity follows the basic
 * model, under which exocyclic double bonds break a ring's aromaticity.
 */
@UtilityClass
public final class IndigoFactory {

  public static Indigo createIndigo() {
    Indigo indigo = new Indigo();
    indigo.setOption("ignore-stereochemistry-errors", true);
    indigo.setOption("ignore-bad-valence", true);
    indigo.setOption("aromaticity-model", "basic");
    return indigo;
  }
}
