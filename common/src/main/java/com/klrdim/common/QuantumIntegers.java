package com.klrdim.common;

import java.math.BigInteger;
import java.util.TreeMap;

/**
 * Quantum integers and q-powers over {@link LaurentPolynomial}.
 *
 * <pre>
 *   [m]_d = (q^{dm} - q^{-dm}) / (q^d - q^{-d})
 *         = q^{d(m-1)} + q^{d(m-3)} + ... + q^{-d(m-1)}     (m &gt; 0)
 *   [0]_d = 0,   [-m]_d = -[m]_d
 * </pre>
 */
public final class QuantumIntegers {

    private QuantumIntegers() {}

    /**
     * The quantum integer {@code [m]} evaluated at {@code q^d}.
     *
     * @param m any integer
     * @param d symmetrizing scalar, must be positive
     */
    public static LaurentPolynomial bracket(int m, int d) {
        requirePositive(d);
        if (m == 0) return LaurentPolynomial.ZERO;
        if (m < 0) return bracket(Math.negateExact(m), d).negate();

        TreeMap<Integer, BigInteger> t = new TreeMap<>();
        for (int i = 0; i < m; i++) {
            t.put(Math.multiplyExact(d, m - 2 * i - 1), BigInteger.ONE);
        }
        return LaurentPolynomial.of(t);
    }

    /** {@code (q^d)^exponent}; the exponent may be negative. */
    public static LaurentPolynomial power(int d, int exponent) {
        requirePositive(d);
        return LaurentPolynomial.q(Math.multiplyExact(d, exponent));
    }

    private static void requirePositive(int d) {
        if (d <= 0) throw new IllegalArgumentException("symmetrizing scalar must be > 0, got " + d);
    }
}
