package com.klrdim.api;

import com.klrdim.common.Permutation;
import com.klrdim.common.WitnessLimitExceededException;
import com.klrdim.config.KlrConfig;
import com.klrdim.formula.core.DimensionResult;
import com.klrdim.formula.core.DimensionTracePrinter;
import com.klrdim.formula.core.DominantWeight;
import com.klrdim.formula.core.ResidueModel;
import com.klrdim.formula.service.DimensionService;
import com.klrdim.quiver.CartanType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point: graded dimension of e(bottom) R^L e(top) for a cyclotomic
 * KLR algebra.
 *
 * <pre>
 *   KlrDimensionSystem klr = new KlrDimensionSystem();
 *   DimensionResult r = klr.computeDimension("B3", DominantWeight.ofLabels(List.of(2, 3)),
 *           List.of(2, 3, 3, 2, 1), List.of(2, 3, 2, 3, 1));
 *   r.getTotal();      // q^8 + 2*q^6 + 2*q^4 + 2*q^2 + 1
 * </pre>
 */
public final class KlrDimensionSystem {

    private static final Logger logger = LoggerFactory.getLogger(KlrDimensionSystem.class);

    static final String USAGE =
            "Usage: <type> <weight> <bottom> [top] [--base=<seq>] [--config=<path>] [--verbose]";

    private final AppBootstrap.Components components;
    private final PrintStream traceOut;

    public KlrDimensionSystem() {
        this(new KlrConfig());
    }

    public KlrDimensionSystem(KlrConfig cfg) {
        this(AppBootstrap.init(cfg), System.out);
    }

    /** @param traceOut where verbose traces go */
    public KlrDimensionSystem(AppBootstrap.Components components, PrintStream traceOut) {
        this.components = Objects.requireNonNull(components, "components");
        this.traceOut = Objects.requireNonNull(traceOut, "traceOut");
    }

    public KlrConfig getConfig() {
        return components.config;
    }

    public MicrometerProfiler getProfiler() {
        return components.profiler;
    }

    // =====================================================================
    // computeDimension overloads
    // =====================================================================

    public DimensionResult computeDimension(String type, DominantWeight weight, List<Integer> bottom) {
        return computeDimension(type, weight, bottom, null, null);
    }

    public DimensionResult computeDimension(String type, DominantWeight weight,
                                            List<Integer> bottom, List<Integer> top) {
        return computeDimension(type, weight, bottom, top, null);
    }

    public DimensionResult computeDimension(String type, DominantWeight weight,
                                            List<Integer> bottom, List<Integer> top, List<Integer> base) {
        return computeDimension(type, weight, bottom, top, base, components.config.isVerbose());
    }

    public DimensionResult computeDimension(String type, DominantWeight weight,
                                            List<Integer> bottom, List<Integer> top, List<Integer> base,
                                            boolean verbose) {
        return computeDimension(CartanType.parse(type), weight, bottom, top, base, verbose);
    }

    /**
     * @param top     null means {@code top = bottom}
     * @param base    null or empty means no base
     * @param verbose print the trace to this system's trace stream
     * @throws com.klrdim.common.KlrInputException on an unknown type, a length mismatch or an invalid vertex
     * @throws WitnessLimitExceededException if the witness set is larger than {@code enumeration.maxWitnesses}
     */
    public DimensionResult computeDimension(CartanType type, DominantWeight weight,
                                            List<Integer> bottom, List<Integer> top, List<Integer> base,
                                            boolean verbose) {
        DimensionService ds = components.dimensionService;
        MicrometerProfiler prof = components.profiler;

        ResidueModel model = ds.prepare(type, weight, bottom, top, base);

        List<Permutation> witnesses;
        long enumerateNs = 0L;
        if (prof != null) prof.start(MicrometerProfiler.PHASE_ENUMERATE);
        try {
            witnesses = ds.enumerate(model);
        } finally {
            if (prof != null) enumerateNs = prof.stop(MicrometerProfiler.PHASE_ENUMERATE);
        }

        DimensionResult result;
        long evaluateNs = 0L;
        if (prof != null) prof.start(MicrometerProfiler.PHASE_EVALUATE);
        try {
            result = ds.evaluate(model, witnesses);
        } finally {
            if (prof != null) evaluateNs = prof.stop(MicrometerProfiler.PHASE_EVALUATE);
        }

        if (prof != null) {
            prof.recordEvaluation(
                    label(model),
                    result.getCartanType(),
                    model.length(),
                    result.getWitnessCount(),
                    result.getNonzeroCount(),
                    result.getGrouping().size(),
                    result.getTotal().toString(),
                    enumerateNs / 1e6,
                    evaluateNs / 1e6);
        }

        if (verbose) DimensionTracePrinter.print(result, traceOut);
        if (components.config.getOutput().isWriteCsv()) writeCsv(result);
        return result;
    }

    private static String label(ResidueModel model) {
        return "e(" + model.bottom() + ")R^L e(" + model.top() + ")";
    }

    private void writeCsv(DimensionResult result) {
        Path dir = Paths.get(components.config.getOutput().getResultsDir());
        try {
            new ResultWriter(dir.resolve("dimensions.csv")).writeDimension(result);
            if (components.profiler != null) {
                components.profiler.getBase().exportEvaluationCsv(dir.resolve("evaluations.csv").toString());
                components.profiler.exportMetersCSV(dir.resolve("metrics.csv").toString());
            }
        } catch (IOException e) {
            logger.warn("Failed to export results to {}: {}", dir, e.toString());
        }
    }

    // =====================================================================
    // command line
    // =====================================================================

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /**
     * Runs the command line and returns its exit status: 0 on success,
     * 2 on invalid input or configuration, 3 when the witness limit is hit.
     * The total is the last line written to {@code out}.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        String base = null;
        String configPath = null;
        boolean verboseFlag = false;

        for (String a : args) {
            if (a.startsWith("--base=")) {
                base = a.substring("--base=".length());
            } else if (a.startsWith("--config=")) {
                configPath = a.substring("--config=".length());
            } else if (a.equals("--verbose")) {
                verboseFlag = true;
            } else if (a.startsWith("--")) {
                err.println("Unknown option " + a);
                err.println(USAGE);
                return 2;
            } else {
                positional.add(a);
            }
        }
        if (positional.size() < 3 || positional.size() > 4) {
            err.println(USAGE);
            return 2;
        }

        try {
            KlrConfig cfg;
            if (configPath == null) {
                cfg = new KlrConfig();
            } else {
                ApiConfig api = new ApiConfig(configPath);
                logger.info("Using configuration {} (sha256 {})", api.getResolvedPath(), api.getSha256());
                cfg = api.getConfig();
            }
            boolean verbose = verboseFlag || cfg.isVerbose();

            CartanType type = CartanType.parse(positional.get(0));
            DominantWeight weight = InputParsers.parseWeight(positional.get(1));
            List<Integer> bottom = InputParsers.parseSequence(positional.get(2));
            List<Integer> top = positional.size() == 4 ? InputParsers.parseSequence(positional.get(3)) : null;
            List<Integer> baseSeq = base == null ? null : InputParsers.parseSequence(base);

            KlrDimensionSystem system = new KlrDimensionSystem(AppBootstrap.init(cfg), out);
            DimensionResult result = system.computeDimension(type, weight, bottom, top, baseSeq, verbose);
            out.println(result.getTotal());
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            logger.debug("Rejected input", e);
            err.println("Invalid input: " + e.getMessage());
            err.println(USAGE);
            return 2;
        } catch (IOException e) {
            err.println("Configuration error: " + e.getMessage());
            return 2;
        } catch (WitnessLimitExceededException e) {
            err.println(e.getMessage());
            return 3;
        }
    }
}
