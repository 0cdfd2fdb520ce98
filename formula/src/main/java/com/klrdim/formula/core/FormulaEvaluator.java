package com.klrdim.formula.core;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;
import com.klrdim.common.QuantumIntegers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hu-Shi contribution of a witness:
 * <pre>
 *   X(w) = prod_t [N(w,t)]_{d(c_t)} * q^{d(c_t) (N(1,t) - 1)}
 * </pre>
 * Stops multiplying at the first zero bracket; the value is then exactly zero.
 */
public final class FormulaEvaluator {

    private final ResidueModel model;
    private final LaurentPolynomial[] powers;

    public FormulaEvaluator(ResidueModel model) {
        this.model = Objects.requireNonNull(model, "model");
        // q-power factors depend only on the baseline
        int n = model.length();
        this.powers = new LaurentPolynomial[n];
        for (int t = 0; t < n; t++) {
            int d = model.quiver().symmetrizer(model.color(t));
            powers[t] = QuantumIntegers.power(d, model.baselineExponent(t) - 1);
        }
    }

    public WitnessEvaluation evaluate(Permutation w) {
        int[] row = model.exponents(w);
        LaurentPolynomial value = LaurentPolynomial.ONE;
        for (int t = 0; t < row.length; t++) {
            if (row[t] == 0) {
                value = LaurentPolynomial.ZERO;
                break;
            }
            int d = model.quiver().symmetrizer(model.color(t));
            value = value.multiply(QuantumIntegers.bracket(row[t], d)).multiply(powers[t]);
        }
        return new WitnessEvaluation(w, row, value);
    }

    public List<WitnessEvaluation> evaluateAll(List<Permutation> witnesses) {
        Objects.requireNonNull(witnesses, "witnesses");
        List<WitnessEvaluation> out = new ArrayList<>(witnesses.size());
        for (Permutation w : witnesses) out.add(evaluate(w));
        return out;
    }
}
