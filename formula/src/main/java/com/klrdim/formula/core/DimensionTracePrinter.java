package com.klrdim.formula.core;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Human-readable trace of an evaluation:
 * <pre>
 * Subgroup of permutations = [(), (1,2), (0,3), (0,3)(1,2)]
 * N(1,t)-1:  0  1 -1  0  1
 * N(w,t):    1  2  0  1  2   ()
 * X(w): 0
 * ...
 * </pre>
 * followed by the grouping view and the total. Output only; nothing here
 * feeds back into the result.
 */
public final class DimensionTracePrinter {

    private static final Logger log = LoggerFactory.getLogger(DimensionTracePrinter.class);

    public static void print(DimensionResult result, PrintStream out) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(out, "out");

        for (String line : lines(result)) out.println(line);
        out.flush();
        log.debug("Trace printed: {}", summary(result));
    }

    public static List<String> lines(DimensionResult result) {
        ResidueModel model = result.getModel();
        List<String> lines = new ArrayList<>();

        lines.add("Cartan type " + result.getCartanType()
                + ", weight " + model.weight()
                + ", bottom " + model.bottom()
                + ", top " + model.top()
                + (model.baseLength() > 0 ? ", base " + model.base() : ""));
        lines.add("Subgroup of permutations = " + result.getWitnesses().stream()
                .map(Permutation::toCycleString)
                .collect(Collectors.joining(", ", "[", "]")));
        lines.add("N(1,t)-1:" + row(model.baselineShiftRow()));

        for (WitnessEvaluation e : result.getEvaluations()) {
            lines.add("N(w,t):  " + row(e.getExponents()) + "   " + e.getWitness().toCycleString());
            lines.add("X(w): " + e.getValue());
        }

        for (Map.Entry<LaurentPolynomial, List<Permutation>> g : result.getGrouping().entrySet()) {
            lines.add(g.getKey() + ": " + g.getValue().stream()
                    .map(Permutation::toCycleString)
                    .collect(Collectors.joining(", ")));
        }
        lines.add("Total: " + result.getTotal());
        return lines;
    }

    /** One line: type, length, witness and group counts, total and its value at q = 1. */
    public static String summary(DimensionResult result) {
        return String.format(Locale.ROOT, "type=%s n=%d witnesses=%d nonzero=%d groups=%d total=%s dim=%s",
                result.getCartanType(),
                result.getModel().length(),
                result.getWitnessCount(),
                result.getNonzeroCount(),
                result.getGrouping().size(),
                result.getTotal(),
                result.getTotal().evaluateAtOne());
    }

    private static String row(int[] values) {
        StringBuilder sb = new StringBuilder();
        for (int v : values) sb.append(String.format(Locale.ROOT, " %2d", v));
        return sb.toString();
    }

    private DimensionTracePrinter() {}
}
