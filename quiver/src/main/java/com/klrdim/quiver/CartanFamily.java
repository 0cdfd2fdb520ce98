package com.klrdim.quiver;

/** Dynkin families; the set is closed. */
public enum CartanFamily {
    A, B, C, D, E, F, G;

    /** Whether {@code rank} is a valid rank for the finite type of this family. */
    public boolean supportsFinite(int rank) {
        return switch (this) {
            case A -> rank >= 1;
            case B, C -> rank >= 2;
            case D -> rank >= 4;
            case E -> rank >= 6 && rank <= 8;
            case F -> rank == 4;
            case G -> rank == 2;
        };
    }

    /** Whether {@code rank} is a valid rank for the untwisted affine type. */
    public boolean supportsAffine(int rank) {
        return switch (this) {
            case B -> rank >= 3;
            default -> supportsFinite(rank);
        };
    }
}
