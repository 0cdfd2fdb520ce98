package com.klrdim.formula.service;

import com.klrdim.common.Permutation;
import com.klrdim.config.KlrConfig;
import com.klrdim.formula.core.DimensionAggregator;
import com.klrdim.formula.core.DimensionResult;
import com.klrdim.formula.core.DimensionTracePrinter;
import com.klrdim.formula.core.DominantWeight;
import com.klrdim.formula.core.FormulaEvaluator;
import com.klrdim.formula.core.ResidueModel;
import com.klrdim.formula.core.WitnessEvaluation;
import com.klrdim.quiver.CartanType;
import com.klrdim.quiver.Quiver;
import com.klrdim.quiver.QuiverDataProvider;
import com.klrdim.witness.service.WitnessService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * DimensionServiceImpl
 *
 * - quiver lookup through {@link QuiverDataProvider}
 * - witnesses from {@link WitnessService}
 * - aggregation mode from {@code aggregation.cancelOppositeContributions}
 *
 * Holds no per-call state; every call builds its own model and aggregate.
 */
public final class DimensionServiceImpl implements DimensionService {

    private static final Logger logger = LoggerFactory.getLogger(DimensionServiceImpl.class);

    private final QuiverDataProvider quivers;
    private final WitnessService witnesses;
    private final KlrConfig cfg;

    public DimensionServiceImpl(QuiverDataProvider quivers, WitnessService witnesses, KlrConfig cfg) {
        this.quivers = Objects.requireNonNull(quivers, "quivers");
        this.witnesses = Objects.requireNonNull(witnesses, "witnesses");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public ResidueModel prepare(CartanType type, DominantWeight weight,
                                List<Integer> bottom, List<Integer> top, List<Integer> base) {
        Objects.requireNonNull(type, "type");
        Quiver quiver = quivers.resolve(type);
        return ResidueModel.of(quiver, weight, bottom, top, base);
    }

    @Override
    public List<Permutation> enumerate(ResidueModel model) {
        Objects.requireNonNull(model, "model");
        return witnesses.enumerate(model.quiver(), model.bottom(), model.top(), model.baseLength());
    }

    @Override
    public DimensionResult evaluate(ResidueModel model, List<Permutation> ws) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(ws, "witnesses");

        FormulaEvaluator evaluator = new FormulaEvaluator(model);
        List<WitnessEvaluation> evaluations = evaluator.evaluateAll(ws);
        if (logger.isDebugEnabled()) {
            for (WitnessEvaluation e : evaluations) logger.debug("{}", e);
        }

        DimensionAggregator aggregator =
                new DimensionAggregator(cfg.getAggregation().isCancelOppositeContributions());
        DimensionAggregator.Aggregate agg = aggregator.aggregate(evaluations);

        DimensionResult result = new DimensionResult(
                model.quiver().getType().toString(), model, evaluations, agg.getGrouping(), agg.getTotal());
        logger.info(DimensionTracePrinter.summary(result));
        return result;
    }
}
