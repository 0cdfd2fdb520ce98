package com.klrdim.witness.core;

import com.klrdim.common.Permutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Backtracking enumeration of a {@link WitnessSpace}.
 *
 * Positions are assigned left to right and candidates tried in ascending
 * order, so the output is sorted lexicographically by one-line notation.
 * Every candidate set is a full color class, hence no branch dead-ends and
 * the work is linear in the number of witnesses.
 */
public final class WitnessEnumerator {

    private WitnessEnumerator() {}

    public static List<Permutation> enumerate(WitnessSpace space) {
        Objects.requireNonNull(space, "space");
        List<Permutation> out = new ArrayList<>();
        if (space.count().signum() == 0) return out;

        int n = space.length();
        int[] image = new int[n];
        boolean[] used = new boolean[n];
        assign(space, 0, image, used, out);
        return out;
    }

    private static void assign(WitnessSpace space, int p, int[] image, boolean[] used, List<Permutation> out) {
        if (p == image.length) {
            out.add(Permutation.of(image));
            return;
        }
        for (int q : space.candidatesView(p)) {
            if (used[q]) continue;
            used[q] = true;
            image[p] = q;
            assign(space, p + 1, image, used, out);
            used[q] = false;
        }
    }

    /** {@code top[w(i)] == bottom[i]} for every position. */
    static boolean isWitness(Permutation w, List<Integer> bottom, List<Integer> top) {
        if (w.size() != bottom.size() || w.size() != top.size()) return false;
        for (int i = 0; i < w.size(); i++) {
            if (!top.get(w.apply(i)).equals(bottom.get(i))) return false;
        }
        return true;
    }
}
