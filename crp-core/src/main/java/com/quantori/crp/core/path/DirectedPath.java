package com.quantori.crp.core.path;

public record DirectedPath(int atom1, int atom2, int bond12, Direction direction) {
}
