package com.klrdim.it;

import com.klrdim.api.AppBootstrap;
import com.klrdim.api.KlrDimensionSystem;
import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;
import com.klrdim.config.KlrConfig;
import com.klrdim.formula.core.DimensionAggregator;
import com.klrdim.formula.core.DimensionResult;
import com.klrdim.formula.core.DominantWeight;
import com.klrdim.formula.core.WitnessEvaluation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.klrdim.common.LaurentPolynomial.q;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reproduction of the documented worked examples through the
 * public entry point.
 */
class DocumentedScenariosTest {

    private static final DominantWeight L23 = DominantWeight.ofLabels(List.of(2, 3));
    private static final List<Integer> BOTTOM = List.of(2, 3, 3, 2, 1);
    private static final List<Integer> TOP = List.of(2, 3, 2, 3, 1);

    private KlrDimensionSystem system;

    @BeforeEach
    void setUp() {
        system = new KlrDimensionSystem(new KlrConfig());
    }

    /** q^k + q^-k */
    private static LaurentPolynomial sym(int k) {
        return q(k).add(q(-k));
    }

    @Test
    @DisplayName("A3: one nonzero witness, (q + 1/q)^2 q")
    void typeA() {
        DimensionResult r = system.computeDimension("A3", L23, BOTTOM, TOP);

        LaurentPolynomial expected = sym(1).multiply(sym(1)).multiply(q(1));
        assertEquals(1, r.getGrouping().size());
        assertEquals(List.of(Permutation.of(2, 3, 1, 0, 4)), r.getGrouping().get(expected));
        assertEquals(q(2).add(LaurentPolynomial.ONE).multiply(q(2).add(LaurentPolynomial.ONE)).multiply(q(-1)),
                r.getTotal());
    }

    @Test
    @DisplayName("B3: two nonzero witnesses, total (q^4 + 1)(q^2 + 1)^2")
    void typeB() {
        DimensionResult r = system.computeDimension("B3", L23, BOTTOM, TOP);

        LaurentPolynomial first = sym(2).multiply(q(4));
        LaurentPolynomial second = sym(2).add(LaurentPolynomial.ONE).multiply(sym(2)).multiply(q(4));
        Map<LaurentPolynomial, List<Permutation>> g = r.getGrouping();
        assertEquals(2, g.size());
        assertEquals(List.of(first, second), new ArrayList<>(g.keySet()));
        assertEquals(1, g.get(first).size());
        assertEquals(1, g.get(second).size());

        LaurentPolynomial qq = q(2).add(LaurentPolynomial.ONE);
        assertEquals(q(4).add(LaurentPolynomial.ONE).multiply(qq).multiply(qq), r.getTotal());
    }

    @Test
    @DisplayName("B3 verbose: four witnesses listed, two contribute")
    void typeBVerbose() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream trace = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        KlrDimensionSystem verbose = new KlrDimensionSystem(AppBootstrap.init(new KlrConfig()), trace);

        DimensionResult r = verbose.computeDimension("B3", L23, BOTTOM, TOP, null, true);

        assertEquals(4, r.getWitnessCount());
        assertEquals(2, r.getNonzeroCount());
        for (WitnessEvaluation e : r.getEvaluations()) {
            if (e.isZero()) {
                assertTrue(r.getGrouping().values().stream().noneMatch(ws -> ws.contains(e.getWitness())));
            }
        }

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Subgroup of permutations = ["), text);
        assertEquals(4, text.lines().filter(l -> l.startsWith("X(w): ")).count());
        assertEquals(2, text.lines().filter(l -> l.equals("X(w): 0")).count());
        assertTrue(text.contains("N(w,t):    1  1  1  1  2"));
        assertTrue(text.contains("N(w,t):    1  3  1  1  2"));
        assertTrue(text.contains("N(1,t)-1:  0  2  0  0  1"));
    }

    @Test
    @DisplayName("B3 with base (2): restricted search yields exactly zero")
    void typeBWithBase() {
        DimensionResult r = system.computeDimension("B3", L23,
                List.of(3, 3, 2, 1), List.of(3, 2, 3, 1), List.of(2));

        assertTrue(r.getGrouping().isEmpty());
        assertTrue(r.getTotal().isZero());
        assertEquals(2, r.getWitnessCount());
    }

    @Test
    void baseRestrictionChangesTheAnswerOnlyWhereItDropsWitnesses() {
        DimensionResult restricted = system.computeDimension("B3", L23,
                List.of(3, 3, 2, 1), List.of(3, 2, 3, 1), List.of(2));
        DimensionResult full = system.computeDimension("B3", L23, BOTTOM, TOP);
        assertNotEquals(restricted.getTotal(), full.getTotal());

        DominantWeight l1 = DominantWeight.ofLabels(List.of(1));
        DimensionResult withBase = system.computeDimension("A3", l1, List.of(2, 3), null, List.of(1));
        DimensionResult without = system.computeDimension("A3", l1, List.of(1, 2, 3));
        assertEquals(without.getTotal(), withBase.getTotal());
        assertEquals(without.getWitnessCount(), withBase.getWitnessCount());
    }

    @Test
    void repeatedCallsAreIdentical() {
        DimensionResult a = system.computeDimension("B3", L23, BOTTOM, TOP);
        DimensionResult b = system.computeDimension("B3", L23, BOTTOM, TOP);

        assertEquals(a.getTotal(), b.getTotal());
        assertEquals(a.getWitnesses(), b.getWitnesses());
        assertEquals(new ArrayList<>(a.getGrouping().entrySet()), new ArrayList<>(b.getGrouping().entrySet()));
    }

    @Test
    @DisplayName("Total is independent of the order contributions are summed in")
    void totalIsOrderIndependent() {
        List<DimensionResult> cases = List.of(
                system.computeDimension("A1", DominantWeight.ofLabels(List.of(1)), List.of(1, 1)),
                system.computeDimension("B3", L23, BOTTOM, TOP),
                system.computeDimension("A3", DominantWeight.ofLabels(List.of(2, 2, 2)),
                        List.of(2, 3, 2, 2, 1), List.of(2, 3, 1, 2, 2)));

        for (DimensionResult r : cases) {
            List<WitnessEvaluation> evals = new ArrayList<>(r.getEvaluations());
            Random rnd = new Random(7L);
            for (int i = 0; i < 20; i++) {
                Collections.shuffle(evals, rnd);
                assertEquals(r.getTotal(), new DimensionAggregator(false).aggregate(evals).getTotal(),
                        r.getCartanType() + " shuffle " + i);
                assertEquals(r.getTotal(), new DimensionAggregator(true).aggregate(evals).getTotal(),
                        r.getCartanType() + " paired shuffle " + i);
            }
        }
        assertTrue(cases.get(0).getTotal().isZero());
        assertEquals(LaurentPolynomial.of(Map.of(8, 1, 6, 3, 4, 4, 2, 3, 0, 1)), cases.get(2).getTotal());
    }

    @Test
    void topDefaultsToBottom() {
        DominantWeight l2 = DominantWeight.ofLabels(List.of(2));
        DimensionResult implicit = system.computeDimension("B3", l2, BOTTOM);
        DimensionResult explicit = system.computeDimension("B3", l2, BOTTOM, BOTTOM);

        assertEquals(explicit.getTotal(), implicit.getTotal());
        assertEquals(LaurentPolynomial.of(Map.of(6, 1, 4, 2, 2, 2, 0, 2, -2, 1)), implicit.getTotal());
    }
}
