package com.klrdim.quiver;

import com.klrdim.common.InvalidVertexException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Resolved Cartan datum: the vertex set, the Cartan integers a(u,v) and the
 * symmetrizing scalars d(u). Immutable.
 *
 * Vertices are addressed by their labels (1..n for finite types, 0..n for
 * affine types), never by row index.
 */
public final class Quiver {

    private final CartanType type;
    private final List<Integer> indexSet;
    private final Map<Integer, Integer> rowOf;
    private final int[][] cartan;
    private final int[] symmetrizer;

    /**
     * @param indexSet    vertex labels, in row order
     * @param cartan      Cartan matrix, rows/columns in {@code indexSet} order
     * @param symmetrizer positive scalars with d(u)a(u,v) symmetric
     */
    public Quiver(CartanType type, List<Integer> indexSet, int[][] cartan, int[] symmetrizer) {
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(indexSet, "indexSet");
        Objects.requireNonNull(cartan, "cartan");
        Objects.requireNonNull(symmetrizer, "symmetrizer");

        int n = indexSet.size();
        if (cartan.length != n || symmetrizer.length != n) {
            throw new IllegalArgumentException("Cartan data size mismatch for " + type);
        }

        Map<Integer, Integer> rows = new TreeMap<>();
        int[][] copy = new int[n][];
        for (int i = 0; i < n; i++) {
            if (cartan[i].length != n) throw new IllegalArgumentException("Cartan matrix must be square");
            if (symmetrizer[i] <= 0) throw new IllegalArgumentException("symmetrizer must be positive");
            if (rows.put(indexSet.get(i), i) != null) {
                throw new IllegalArgumentException("duplicate vertex " + indexSet.get(i));
            }
            copy[i] = cartan[i].clone();
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (symmetrizer[i] * copy[i][j] != symmetrizer[j] * copy[j][i]) {
                    throw new IllegalArgumentException("symmetrizer does not symmetrize " + type);
                }
            }
        }

        this.indexSet = List.copyOf(indexSet);
        this.rowOf = Collections.unmodifiableMap(rows);
        this.cartan = copy;
        this.symmetrizer = symmetrizer.clone();
    }

    public CartanType getType() {
        return type;
    }

    List<Integer> indexSet() {
        return indexSet;
    }

    public boolean contains(int vertex) {
        return rowOf.containsKey(vertex);
    }

    /** a(u,v) */
    public int cartanInteger(int u, int v) {
        return cartan[row(u)][row(v)];
    }

    /** d(u) */
    public int symmetrizer(int u) {
        return symmetrizer[row(u)];
    }

    /** u and v are distinct and joined by an edge. */
    boolean adjacent(int u, int v) {
        return u != v && cartanInteger(u, v) != 0;
    }

    /**
     * @throws InvalidVertexException for any label outside the index set
     */
    public void requireVertices(String where, Iterable<Integer> labels) {
        for (Integer v : labels) {
            if (v == null || !contains(v)) {
                throw new InvalidVertexException(where, v == null ? Integer.MIN_VALUE : v, indexSet);
            }
        }
    }

    private int row(int vertex) {
        Integer r = rowOf.get(vertex);
        if (r == null) throw new InvalidVertexException("quiver " + type, vertex, indexSet);
        return r;
    }

    @Override
    public String toString() {
        return "Quiver{" + type + ", I=" + indexSet
                + ", d=" + Arrays.toString(symmetrizer) + '}';
    }
}
