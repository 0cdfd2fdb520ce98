package com.klrdim.formula.core;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds witness evaluations into the grouping view and the total.
 *
 * The total is the sum of every contribution. Zero contributions never enter
 * the grouping. With opposite-sign pairing on, a contribution X whose
 * negation is already a group key removes the longest witness of that group
 * instead of being recorded, and groups are kept sorted by Coxeter length.
 */
public final class DimensionAggregator {

    private static final Comparator<Permutation> BY_LENGTH = Comparator.comparingInt(Permutation::length);

    private final boolean cancelOpposite;

    public DimensionAggregator(boolean cancelOpposite) {
        this.cancelOpposite = cancelOpposite;
    }

    public Aggregate aggregate(List<WitnessEvaluation> evaluations) {
        Objects.requireNonNull(evaluations, "evaluations");
        LinkedHashMap<LaurentPolynomial, List<Permutation>> grouping = new LinkedHashMap<>();
        LaurentPolynomial total = LaurentPolynomial.ZERO;

        for (WitnessEvaluation e : evaluations) {
            LaurentPolynomial x = e.getValue();
            total = total.add(x);
            if (x.isZero()) continue;

            if (cancelOpposite) {
                LaurentPolynomial negated = x.negate();
                List<Permutation> opposite = grouping.get(negated);
                if (opposite != null) {
                    opposite.remove(opposite.size() - 1);
                    if (opposite.isEmpty()) grouping.remove(negated);
                    continue;
                }
            }

            List<Permutation> group = grouping.computeIfAbsent(x, k -> new ArrayList<>());
            group.add(e.getWitness());
            if (cancelOpposite) group.sort(BY_LENGTH);
        }
        return new Aggregate(grouping, total);
    }

    /** Grouping view plus total. */
    public static final class Aggregate {
        private final Map<LaurentPolynomial, List<Permutation>> grouping;
        private final LaurentPolynomial total;

        Aggregate(Map<LaurentPolynomial, List<Permutation>> grouping, LaurentPolynomial total) {
            this.grouping = grouping;
            this.total = total;
        }

        public Map<LaurentPolynomial, List<Permutation>> getGrouping() { return grouping; }
        public LaurentPolynomial getTotal() { return total; }
    }
}
