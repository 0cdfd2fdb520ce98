package com.klrdim.common;

import java.util.List;

/** Bottom and top residue sequences have different lengths. */
public class LengthMismatchException extends KlrInputException {

    public LengthMismatchException(List<Integer> bottom, List<Integer> top) {
        super(bottom + " and " + top + " must have the same length");
    }
}
