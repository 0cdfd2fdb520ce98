package com.klrdim.witness.core;

import com.klrdim.quiver.Quiver;

import java.util.List;
import java.util.Objects;

/**
 * Partition of the base prefix into the orbits of the group generated by
 * the base transpositions.
 *
 * For base position i let j be the first later position whose color is not
 * orthogonal to {@code base[i]}. If {@code base[j] == base[i]} then (i j)
 * is a generator. Positions that no generator touches are singletons.
 */
public final class BaseTranspositions {

    private BaseTranspositions() {}

    /**
     * @return orbit id per base position; equal ids mean the same orbit,
     *         and ids are the smallest position in the orbit
     */
    public static int[] orbits(List<Integer> base, Quiver quiver) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(quiver, "quiver");
        int k = base.size();
        int[] parent = new int[k];
        for (int i = 0; i < k; i++) parent[i] = i;

        for (int i = 0; i < k - 1; i++) {
            int j = i + 1;
            while (j < k && quiver.cartanInteger(base.get(i), base.get(j)) == 0) j++;
            if (j < k && base.get(i).equals(base.get(j))) union(parent, i, j);
        }

        int[] ids = new int[k];
        for (int i = 0; i < k; i++) ids[i] = find(parent, i);
        return ids;
    }

    /** Every base position in its own orbit: the frozen prefix. */
    public static int[] frozen(int baseLength) {
        int[] ids = new int[baseLength];
        for (int i = 0; i < baseLength; i++) ids[i] = i;
        return ids;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra == rb) return;
        // keep the smaller position as root
        if (ra < rb) parent[rb] = ra;
        else parent[ra] = rb;
    }
}
