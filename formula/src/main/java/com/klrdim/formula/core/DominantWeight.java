package com.klrdim.formula.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Dominant weight as red-string multiplicities per vertex label.
 * Labels with multiplicity 0 are not stored.
 */
public final class DominantWeight {

    private final Map<Integer, Integer> multiplicities;

    private DominantWeight(Map<Integer, Integer> multiplicities) {
        this.multiplicities = Collections.unmodifiableMap(multiplicities);
    }

    /**
     * @throws IllegalArgumentException on a negative multiplicity
     */
    public static DominantWeight of(Map<Integer, Integer> multiplicities) {
        Objects.requireNonNull(multiplicities, "multiplicities");
        TreeMap<Integer, Integer> m = new TreeMap<>();
        for (Map.Entry<Integer, Integer> e : multiplicities.entrySet()) {
            Integer label = Objects.requireNonNull(e.getKey(), "label");
            int mult = Objects.requireNonNull(e.getValue(), "multiplicity");
            if (mult < 0) {
                throw new IllegalArgumentException("negative multiplicity " + mult + " for vertex " + label);
            }
            if (mult > 0) m.put(label, mult);
        }
        return new DominantWeight(m);
    }

    /** {@code [2, 3]} is L_2 + L_3, {@code [1, 1]} is 2 L_1. */
    public static DominantWeight ofLabels(List<Integer> labels) {
        Objects.requireNonNull(labels, "labels");
        TreeMap<Integer, Integer> m = new TreeMap<>();
        for (Integer label : labels) {
            m.merge(Objects.requireNonNull(label, "label"), 1, Integer::sum);
        }
        return new DominantWeight(m);
    }

    /** Number of red strings of color {@code vertex}; 0 when absent. */
    public int multiplicity(int vertex) {
        return multiplicities.getOrDefault(vertex, 0);
    }

    public Set<Integer> labels() {
        return multiplicities.keySet();
    }

    int level() {
        int sum = 0;
        for (int m : multiplicities.values()) sum += m;
        return sum;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DominantWeight that)) return false;
        return multiplicities.equals(that.multiplicities);
    }

    @Override
    public int hashCode() {
        return multiplicities.hashCode();
    }

    /** e.g. {@code L_2 + 2*L_3}, or {@code 0} */
    @Override
    public String toString() {
        if (multiplicities.isEmpty()) return "0";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Integer> e : multiplicities.entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            if (e.getValue() != 1) sb.append(e.getValue()).append('*');
            sb.append("L_").append(e.getKey());
        }
        return sb.toString();
    }
}
