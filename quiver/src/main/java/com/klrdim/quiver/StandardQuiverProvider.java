package com.klrdim.quiver;

import com.klrdim.common.UnknownCartanTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds finite (A-G) and untwisted affine Cartan data from the symmetric
 * bilinear form on simple roots.
 *
 * Conventions:
 * <ul>
 *   <li>{@code a(i,j) = (a_i,a_j) / d(i)} with {@code (a_i,a_i) = 2 d(i)}</li>
 *   <li>shortest root has {@code d = 1}</li>
 *   <li>finite labels 1..n in Bourbaki order, affine node 0 added for untwisted types</li>
 * </ul>
 * Resolved quivers are immutable, so they are cached per descriptor.
 */
public final class StandardQuiverProvider implements QuiverDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(StandardQuiverProvider.class);

    private final Map<CartanType, Quiver> cache = new ConcurrentHashMap<>();

    @Override
    public Quiver resolve(CartanType type) {
        Objects.requireNonNull(type, "type");
        checkRank(type);
        return cache.computeIfAbsent(type, StandardQuiverProvider::build);
    }

    private static void checkRank(CartanType type) {
        CartanFamily f = type.getFamily();
        boolean ok = type.isAffine() ? f.supportsAffine(type.getRank()) : f.supportsFinite(type.getRank());
        if (!ok) {
            throw new UnknownCartanTypeException(
                    "unsupported rank " + type.getRank() + " for "
                            + (type.isAffine() ? "affine " : "") + "type " + f);
        }
    }

    private static Quiver build(CartanType type) {
        int n = type.getRank();
        // row r holds label r for affine types (node 0 first), label r+1 otherwise
        int offset = type.isAffine() ? 0 : 1;
        int size = type.isAffine() ? n + 1 : n;

        Form form = new Form(size, offset);
        finitePart(type.getFamily(), n, form);
        if (type.isAffine()) affineNode(type.getFamily(), n, form);

        List<Integer> labels = new ArrayList<>(size);
        for (int r = 0; r < size; r++) labels.add(r + offset);

        Quiver q = new Quiver(type, labels, form.cartan(), form.d);
        logger.debug("Resolved {}", q);
        return q;
    }

    // -----------------------------------------------------------------
    // finite Dynkin diagrams, labels 1..n
    // -----------------------------------------------------------------

    private static void finitePart(CartanFamily family, int n, Form f) {
        switch (family) {
            case A -> {
                for (int i = 1; i <= n; i++) f.scalar(i, 1);
                for (int i = 1; i < n; i++) f.edge(i, i + 1, -1);
            }
            case B -> {
                for (int i = 1; i < n; i++) f.scalar(i, 2);
                f.scalar(n, 1);
                for (int i = 1; i < n; i++) f.edge(i, i + 1, -2);
            }
            case C -> {
                for (int i = 1; i < n; i++) f.scalar(i, 1);
                f.scalar(n, 2);
                for (int i = 1; i < n - 1; i++) f.edge(i, i + 1, -1);
                f.edge(n - 1, n, -2);
            }
            case D -> {
                for (int i = 1; i <= n; i++) f.scalar(i, 1);
                for (int i = 1; i < n - 1; i++) f.edge(i, i + 1, -1);
                f.edge(n - 2, n, -1);
            }
            case E -> {
                for (int i = 1; i <= n; i++) f.scalar(i, 1);
                f.edge(1, 3, -1);
                f.edge(3, 4, -1);
                f.edge(4, 5, -1);
                f.edge(5, 6, -1);
                f.edge(2, 4, -1);
                if (n >= 7) f.edge(6, 7, -1);
                if (n >= 8) f.edge(7, 8, -1);
            }
            case F -> {
                f.scalar(1, 2);
                f.scalar(2, 2);
                f.scalar(3, 1);
                f.scalar(4, 1);
                f.edge(1, 2, -2);
                f.edge(2, 3, -2);
                f.edge(3, 4, -1);
            }
            case G -> {
                f.scalar(1, 1);
                f.scalar(2, 3);
                f.edge(1, 2, -3);
            }
        }
    }

    // -----------------------------------------------------------------
    // node 0 of the untwisted affine diagrams
    // -----------------------------------------------------------------

    private static void affineNode(CartanFamily family, int n, Form f) {
        switch (family) {
            case A -> {
                f.scalar(0, 1);
                if (n == 1) {
                    f.edge(0, 1, -2);
                } else {
                    f.edge(0, 1, -1);
                    f.edge(0, n, -1);
                }
            }
            case B -> {
                f.scalar(0, 2);
                f.edge(0, 2, -2);
            }
            case C -> {
                f.scalar(0, 2);
                f.edge(0, 1, -2);
            }
            case D -> {
                f.scalar(0, 1);
                f.edge(0, 2, -1);
            }
            case E -> {
                f.scalar(0, 1);
                int attach = switch (n) {
                    case 6 -> 2;
                    case 7 -> 1;
                    default -> 8;
                };
                f.edge(0, attach, -1);
            }
            case F -> {
                f.scalar(0, 2);
                f.edge(0, 1, -2);
            }
            case G -> {
                f.scalar(0, 3);
                f.edge(0, 2, -3);
            }
        }
    }

    /** Symmetric form under construction, addressed by vertex label. */
    private static final class Form {
        final int offset;
        final int[] d;
        final int[][] s;

        Form(int size, int offset) {
            this.offset = offset;
            this.d = new int[size];
            this.s = new int[size][size];
        }

        void scalar(int label, int value) {
            d[label - offset] = value;
            s[label - offset][label - offset] = 2 * value;
        }

        void edge(int u, int v, int weight) {
            s[u - offset][v - offset] = weight;
            s[v - offset][u - offset] = weight;
        }

        int[][] cartan() {
            int size = d.length;
            int[][] a = new int[size][size];
            for (int i = 0; i < size; i++) {
                for (int j = 0; j < size; j++) {
                    if (s[i][j] % d[i] != 0) {
                        throw new IllegalStateException("non-integral Cartan entry at " + i + "," + j);
                    }
                    a[i][j] = s[i][j] / d[i];
                }
            }
            return a;
        }
    }
}
