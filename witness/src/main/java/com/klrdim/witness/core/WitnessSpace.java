package com.klrdim.witness.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Candidate images for every working position.
 *
 * Base positions may only move inside their orbit. A suffix position p may
 * go to any suffix position q with {@code top[q] == bottom[p]}. The admissible
 * witnesses are exactly the bijections that pick one candidate per position,
 * so their number is known before anything is enumerated.
 */
public final class WitnessSpace {

    private final int length;
    private final int baseLength;
    private final int[][] candidates;
    private final BigInteger count;

    private WitnessSpace(int length, int baseLength, int[][] candidates, BigInteger count) {
        this.length = length;
        this.baseLength = baseLength;
        this.candidates = candidates;
        this.count = count;
    }

    /**
     * @param bottom     working bottom sequence (base followed by bottom)
     * @param top        working top sequence (base followed by top), same length
     * @param baseLength length of the shared prefix
     * @param baseOrbits orbit id per base position, see {@link BaseTranspositions}
     */
    public static WitnessSpace of(List<Integer> bottom, List<Integer> top, int baseLength, int[] baseOrbits) {
        Objects.requireNonNull(bottom, "bottom");
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(baseOrbits, "baseOrbits");
        int n = bottom.size();
        if (top.size() != n) throw new IllegalArgumentException("working sequences differ in length");
        if (baseLength < 0 || baseLength > n || baseOrbits.length != baseLength) {
            throw new IllegalArgumentException("bad base length " + baseLength + " for n=" + n);
        }

        int[][] cand = new int[n][];

        // base: orbit members, ascending
        Map<Integer, List<Integer>> orbitMembers = new HashMap<>();
        for (int p = 0; p < baseLength; p++) {
            orbitMembers.computeIfAbsent(baseOrbits[p], x -> new ArrayList<>()).add(p);
        }
        BigInteger count = BigInteger.ONE;
        for (List<Integer> members : orbitMembers.values()) {
            count = count.multiply(factorial(members.size()));
        }
        for (int p = 0; p < baseLength; p++) {
            cand[p] = toArray(orbitMembers.get(baseOrbits[p]));
        }

        // suffix: same-colored top positions, ascending
        Map<Integer, List<Integer>> topByColor = new HashMap<>();
        for (int q = baseLength; q < n; q++) {
            topByColor.computeIfAbsent(top.get(q), x -> new ArrayList<>()).add(q);
        }
        Map<Integer, Integer> bottomCounts = new HashMap<>();
        for (int p = baseLength; p < n; p++) {
            List<Integer> qs = topByColor.getOrDefault(bottom.get(p), Collections.emptyList());
            cand[p] = toArray(qs);
            bottomCounts.merge(bottom.get(p), 1, Integer::sum);
        }

        boolean balanced = bottomCounts.size() == topByColor.size();
        for (Map.Entry<Integer, Integer> e : bottomCounts.entrySet()) {
            List<Integer> qs = topByColor.get(e.getKey());
            if (qs == null || qs.size() != e.getValue()) {
                balanced = false;
                break;
            }
        }
        if (balanced) {
            for (int m : bottomCounts.values()) count = count.multiply(factorial(m));
        } else {
            count = BigInteger.ZERO;
        }

        return new WitnessSpace(n, baseLength, cand, count);
    }

    public int length() {
        return length;
    }

    public int baseLength() {
        return baseLength;
    }

    /** Ascending candidate images of position p; callers must not modify it. */
    int[] candidatesView(int p) {
        return candidates[p];
    }

    /** Exact number of admissible witnesses. */
    public BigInteger count() {
        return count;
    }

    private static int[] toArray(List<Integer> xs) {
        int[] a = new int[xs.size()];
        for (int i = 0; i < a.length; i++) a[i] = xs.get(i);
        return a;
    }

    private static BigInteger factorial(int m) {
        BigInteger f = BigInteger.ONE;
        for (int i = 2; i <= m; i++) f = f.multiply(BigInteger.valueOf(i));
        return f;
    }
}
