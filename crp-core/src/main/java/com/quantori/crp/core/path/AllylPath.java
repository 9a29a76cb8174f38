package com.quantori.crp.core.path;

/**
 * Three atoms joined by two bonds, {@code atom1 - bond12 - atom2 - bond23 - atom3}.
 */
public record AllylPath(int atom1, int atom2, int atom3, int bond12, int bond23) {
}
