package com.klrdim.formula.core;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;

import java.util.Objects;

/** One witness, its raw N(w,t) row and its contribution X(w). */
public final class WitnessEvaluation {

    private final Permutation witness;
    private final int[] exponents;
    private final LaurentPolynomial value;

    public WitnessEvaluation(Permutation witness, int[] exponents, LaurentPolynomial value) {
        this.witness = Objects.requireNonNull(witness, "witness");
        this.exponents = Objects.requireNonNull(exponents, "exponents").clone();
        this.value = Objects.requireNonNull(value, "value");
    }

    public Permutation getWitness() { return witness; }
    public int[] getExponents() { return exponents.clone(); }
    public LaurentPolynomial getValue() { return value; }

    public boolean isZero() {
        return value.isZero();
    }

    @Override
    public String toString() {
        return "X(" + witness.toCycleString() + ") = " + value;
    }
}
