package com.klrdim.common;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable bijection of the positions {@code 0..n-1}, stored in one-line
 * notation: {@code image[i] = w(i)}.
 */
public final class Permutation {

    private final int[] image;

    private Permutation(int[] image) {
        this.image = image;
    }

    public static Permutation identity(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        int[] img = new int[n];
        for (int i = 0; i < n; i++) img[i] = i;
        return new Permutation(img);
    }

    /** @throws IllegalArgumentException if the images are not a bijection of 0..n-1 */
    public static Permutation of(int... image) {
        Objects.requireNonNull(image, "image");
        int n = image.length;
        boolean[] seen = new boolean[n];
        for (int v : image) {
            if (v < 0 || v >= n || seen[v]) {
                throw new IllegalArgumentException("not a permutation: " + Arrays.toString(image));
            }
            seen[v] = true;
        }
        return new Permutation(image.clone());
    }

    public int size() {
        return image.length;
    }

    /** w(i) */
    public int apply(int i) {
        return image[i];
    }

    /** Coxeter length: number of inversions. */
    public int length() {
        int inv = 0;
        for (int i = 0; i < image.length; i++) {
            for (int j = i + 1; j < image.length; j++) {
                if (image[i] > image[j]) inv++;
            }
        }
        return inv;
    }

    /** e.g. {@code [2, 3, 1, 0, 4]} */
    public String toOneLineString() {
        return Arrays.toString(image);
    }

    /**
     * Disjoint-cycle notation with 0-based positions, fixed points omitted,
     * e.g. {@code (0,3)(1,2)}; the identity is {@code ()}.
     */
    public String toCycleString() {
        StringBuilder sb = new StringBuilder();
        boolean[] done = new boolean[image.length];
        for (int start = 0; start < image.length; start++) {
            if (done[start] || image[start] == start) {
                done[start] = true;
                continue;
            }
            sb.append('(').append(start);
            done[start] = true;
            for (int k = image[start]; k != start; k = image[k]) {
                sb.append(',').append(k);
                done[k] = true;
            }
            sb.append(')');
        }
        return sb.length() == 0 ? "()" : sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Permutation that)) return false;
        return Arrays.equals(image, that.image);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(image);
    }

    @Override
    public String toString() {
        return toCycleString();
    }
}
