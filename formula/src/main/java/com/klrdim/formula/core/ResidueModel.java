package com.klrdim.formula.core;

import com.klrdim.common.LengthMismatchException;
import com.klrdim.common.Permutation;
import com.klrdim.quiver.Quiver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validated evaluation input: quiver, dominant weight and the working
 * sequences (base followed by bottom, base followed by top).
 *
 * Exponents, with c_t the color at working position t of the bottom sequence:
 * <pre>
 *   N(w,t) = L(c_t) - sum over j &lt; t with w(j) &lt; w(t) of a(c_t, c_j)
 *   N(1,t) = N(identity, t)
 * </pre>
 * Positions are 0-based.
 */
public final class ResidueModel {

    private final Quiver quiver;
    private final DominantWeight weight;
    private final List<Integer> base;
    private final List<Integer> bottom;
    private final List<Integer> top;
    private final int[] baseline;

    private ResidueModel(Quiver quiver, DominantWeight weight,
                         List<Integer> base, List<Integer> bottom, List<Integer> top) {
        this.quiver = quiver;
        this.weight = weight;
        this.base = base;
        this.bottom = bottom;
        this.top = top;
        this.baseline = exponents(Permutation.identity(bottom.size()));
    }

    /**
     * @param top  null means {@code top = bottom}
     * @param base null means no base
     * @throws LengthMismatchException if bottom and top differ in length
     * @throws com.klrdim.common.InvalidVertexException if any label is not a vertex of the quiver
     */
    public static ResidueModel of(Quiver quiver, DominantWeight weight,
                                  List<Integer> bottom, List<Integer> top, List<Integer> base) {
        Objects.requireNonNull(quiver, "quiver");
        Objects.requireNonNull(weight, "weight");
        Objects.requireNonNull(bottom, "bottom");
        List<Integer> t = top == null ? bottom : top;
        List<Integer> b = base == null ? List.of() : base;

        if (bottom.size() != t.size()) throw new LengthMismatchException(bottom, t);

        quiver.requireVertices("bottom " + bottom, bottom);
        quiver.requireVertices("top " + t, t);
        quiver.requireVertices("base " + b, b);
        quiver.requireVertices("dominant weight " + weight, weight.labels());

        return new ResidueModel(quiver, weight, List.copyOf(b), concat(b, bottom), concat(b, t));
    }

    private static List<Integer> concat(List<Integer> prefix, List<Integer> rest) {
        List<Integer> out = new ArrayList<>(prefix.size() + rest.size());
        out.addAll(prefix);
        out.addAll(rest);
        return List.copyOf(out);
    }

    public Quiver quiver() {
        return quiver;
    }

    public DominantWeight weight() {
        return weight;
    }

    public List<Integer> base() {
        return base;
    }

    public int baseLength() {
        return base.size();
    }

    /** Working bottom sequence, base included. */
    public List<Integer> bottom() {
        return bottom;
    }

    /** Working top sequence, base included. */
    public List<Integer> top() {
        return top;
    }

    public int length() {
        return bottom.size();
    }

    public int color(int t) {
        return bottom.get(t);
    }

    /** N(1,t) */
    public int baselineExponent(int t) {
        return baseline[t];
    }

    /** N(w,t) */
    public int exponent(Permutation w, int t) {
        int c = bottom.get(t);
        int n = weight.multiplicity(c);
        int wt = w.apply(t);
        for (int j = 0; j < t; j++) {
            if (w.apply(j) < wt) n -= quiver.cartanInteger(c, bottom.get(j));
        }
        return n;
    }

    /** N(w,t) for every position. */
    public int[] exponents(Permutation w) {
        Objects.requireNonNull(w, "w");
        if (w.size() != bottom.size()) {
            throw new IllegalArgumentException("witness size " + w.size() + " != " + bottom.size());
        }
        int[] row = new int[bottom.size()];
        for (int t = 0; t < row.length; t++) row[t] = exponent(w, t);
        return row;
    }

    /** N(1,t) - 1 for every position: the exponents of the q-power factors. */
    public int[] baselineShiftRow() {
        int[] row = baseline.clone();
        for (int t = 0; t < row.length; t++) row[t] -= 1;
        return row;
    }
}
