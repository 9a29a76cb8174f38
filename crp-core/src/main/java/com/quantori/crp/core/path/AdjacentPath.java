package com.quantori.crp.core.path;

/**
 * A pair of atoms exchanging a lone pair and a radical. For the N5dc shift the two atoms are not bonded to each
 * other but share the central nitrogen.
 */
public record AdjacentPath(int atom1, int atom2) {
}
