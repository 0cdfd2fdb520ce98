package com.klrdim.formula.core;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one dimension evaluation.
 *
 * {@link #getTotal()} is the graded dimension. {@link #getGrouping()} is the
 * diagnostic view: nonzero contribution values mapped to the witnesses that
 * produced them, in order of first occurrence. The per-witness evaluations
 * (zero ones included) are kept for trace output.
 */
public final class DimensionResult {

    private final String cartanType;
    private final ResidueModel model;
    private final List<WitnessEvaluation> evaluations;
    private final Map<LaurentPolynomial, List<Permutation>> grouping;
    private final LaurentPolynomial total;

    public DimensionResult(String cartanType,
                           ResidueModel model,
                           List<WitnessEvaluation> evaluations,
                           Map<LaurentPolynomial, List<Permutation>> grouping,
                           LaurentPolynomial total) {
        this.cartanType = Objects.requireNonNull(cartanType, "cartanType");
        this.model = Objects.requireNonNull(model, "model");
        this.evaluations = List.copyOf(evaluations);
        LinkedHashMap<LaurentPolynomial, List<Permutation>> g = new LinkedHashMap<>();
        for (Map.Entry<LaurentPolynomial, List<Permutation>> e : grouping.entrySet()) {
            g.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.grouping = Collections.unmodifiableMap(g);
        this.total = Objects.requireNonNull(total, "total");
    }

    public String getCartanType() { return cartanType; }
    public ResidueModel getModel() { return model; }
    public List<WitnessEvaluation> getEvaluations() { return evaluations; }
    public Map<LaurentPolynomial, List<Permutation>> getGrouping() { return grouping; }
    public LaurentPolynomial getTotal() { return total; }

    /** Enumerated witnesses, in enumeration order. */
    public List<Permutation> getWitnesses() {
        List<Permutation> ws = new ArrayList<>(evaluations.size());
        for (WitnessEvaluation e : evaluations) ws.add(e.getWitness());
        return ws;
    }

    public int getWitnessCount() {
        return evaluations.size();
    }

    public int getNonzeroCount() {
        int c = 0;
        for (WitnessEvaluation e : evaluations) {
            if (!e.isZero()) c++;
        }
        return c;
    }

    @Override
    public String toString() {
        return "DimensionResult{type=" + cartanType
                + ", n=" + model.length()
                + ", witnesses=" + evaluations.size()
                + ", groups=" + grouping.size()
                + ", total=" + total + '}';
    }
}
