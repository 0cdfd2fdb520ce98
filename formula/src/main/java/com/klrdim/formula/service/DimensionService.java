package com.klrdim.formula.service;

import com.klrdim.common.Permutation;
import com.klrdim.formula.core.DimensionResult;
import com.klrdim.formula.core.DominantWeight;
import com.klrdim.formula.core.ResidueModel;
import com.klrdim.quiver.CartanType;

import java.util.List;

/**
 * Graded dimension of e(bottom) R^L e(top) by the Hu-Shi formula.
 *
 * The three phases are exposed separately so callers can time them;
 * {@link #computeDimension} runs them in order.
 */
public interface DimensionService {

    /** Resolves the quiver and validates every input. */
    ResidueModel prepare(CartanType type, DominantWeight weight,
                         List<Integer> bottom, List<Integer> top, List<Integer> base);

    List<Permutation> enumerate(ResidueModel model);

    DimensionResult evaluate(ResidueModel model, List<Permutation> witnesses);

    default DimensionResult computeDimension(CartanType type, DominantWeight weight,
                                             List<Integer> bottom, List<Integer> top, List<Integer> base) {
        ResidueModel model = prepare(type, weight, bottom, top, base);
        return evaluate(model, enumerate(model));
    }
}
