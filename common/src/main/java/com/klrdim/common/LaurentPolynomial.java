package com.klrdim.common;

import java.math.BigInteger;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Exact Laurent polynomial in one formal variable {@code q} with
 * arbitrary-precision integer coefficients.
 *
 * Instances are immutable and always canonical: like powers are collected
 * and zero coefficients are dropped, so two mathematically equal values are
 * {@link #equals(Object) equal} and hash alike, which makes them usable as
 * grouping keys.
 * The zero value has no terms.
 */
public final class LaurentPolynomial {

    public static final LaurentPolynomial ZERO = new LaurentPolynomial(new TreeMap<>());
    public static final LaurentPolynomial ONE = monomial(BigInteger.ONE, 0);

    /** exponent -> nonzero coefficient */
    private final NavigableMap<Integer, BigInteger> terms;

    private LaurentPolynomial(NavigableMap<Integer, BigInteger> terms) {
        this.terms = terms;
    }

    public static LaurentPolynomial monomial(long coefficient, int exponent) {
        return monomial(BigInteger.valueOf(coefficient), exponent);
    }

    public static LaurentPolynomial monomial(BigInteger coefficient, int exponent) {
        Objects.requireNonNull(coefficient, "coefficient");
        TreeMap<Integer, BigInteger> t = new TreeMap<>();
        if (coefficient.signum() != 0) t.put(exponent, coefficient);
        return t.isEmpty() ? ZERO : new LaurentPolynomial(t);
    }

    /** q^exponent */
    public static LaurentPolynomial q(int exponent) {
        return monomial(BigInteger.ONE, exponent);
    }

    /**
     * Builds a value from exponent/coefficient pairs; repeated exponents are summed.
     */
    public static LaurentPolynomial of(Map<Integer, ? extends Number> coefficients) {
        Objects.requireNonNull(coefficients, "coefficients");
        TreeMap<Integer, BigInteger> t = new TreeMap<>();
        for (Map.Entry<Integer, ? extends Number> e : coefficients.entrySet()) {
            accumulate(t, e.getKey(), toBig(e.getValue()));
        }
        return wrap(t);
    }

    /* ------------------------------------------------------------
     * Arithmetic
     * ------------------------------------------------------------ */

    public LaurentPolynomial add(LaurentPolynomial other) {
        Objects.requireNonNull(other, "other");
        if (other.isZero()) return this;
        if (this.isZero()) return other;
        TreeMap<Integer, BigInteger> t = new TreeMap<>(terms);
        for (Map.Entry<Integer, BigInteger> e : other.terms.entrySet()) {
            accumulate(t, e.getKey(), e.getValue());
        }
        return wrap(t);
    }

    public LaurentPolynomial multiply(LaurentPolynomial other) {
        Objects.requireNonNull(other, "other");
        if (this.isZero() || other.isZero()) return ZERO;
        TreeMap<Integer, BigInteger> t = new TreeMap<>();
        for (Map.Entry<Integer, BigInteger> a : terms.entrySet()) {
            for (Map.Entry<Integer, BigInteger> b : other.terms.entrySet()) {
                int exp = Math.addExact(a.getKey(), b.getKey());
                accumulate(t, exp, a.getValue().multiply(b.getValue()));
            }
        }
        return wrap(t);
    }

    public LaurentPolynomial negate() {
        if (isZero()) return this;
        TreeMap<Integer, BigInteger> t = new TreeMap<>();
        for (Map.Entry<Integer, BigInteger> e : terms.entrySet()) {
            t.put(e.getKey(), e.getValue().negate());
        }
        return new LaurentPolynomial(t);
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /* ------------------------------------------------------------
     * Inspection
     * ------------------------------------------------------------ */

    BigInteger coefficient(int exponent) {
        return terms.getOrDefault(exponent, BigInteger.ZERO);
    }

    /** Value at q = 1, i.e. the ungraded dimension of a graded dimension. */
    public BigInteger evaluateAtOne() {
        BigInteger sum = BigInteger.ZERO;
        for (BigInteger c : terms.values()) sum = sum.add(c);
        return sum;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LaurentPolynomial that)) return false;
        return terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    /**
     * Descending powers, e.g. {@code q^3 + 2*q + q^-1}; {@code 0} for zero.
     */
    @Override
    public String toString() {
        if (isZero()) return "0";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, BigInteger> e : terms.descendingMap().entrySet()) {
            int exp = e.getKey();
            BigInteger c = e.getValue();
            boolean negative = c.signum() < 0;
            BigInteger abs = c.abs();

            if (sb.length() == 0) {
                if (negative) sb.append('-');
            } else {
                sb.append(negative ? " - " : " + ");
            }

            if (exp == 0) {
                sb.append(abs);
                continue;
            }
            if (!abs.equals(BigInteger.ONE)) sb.append(abs).append('*');
            sb.append('q');
            if (exp != 1) sb.append('^').append(exp);
        }
        return sb.toString();
    }

    /* ------------------------------------------------------------
     * Helpers
     * ------------------------------------------------------------ */

    private static void accumulate(TreeMap<Integer, BigInteger> t, int exp, BigInteger c) {
        if (c.signum() == 0) return;
        BigInteger sum = t.getOrDefault(exp, BigInteger.ZERO).add(c);
        if (sum.signum() == 0) {
            t.remove(exp);
        } else {
            t.put(exp, sum);
        }
    }

    private static LaurentPolynomial wrap(TreeMap<Integer, BigInteger> t) {
        return t.isEmpty() ? ZERO : new LaurentPolynomial(t);
    }

    private static BigInteger toBig(Number n) {
        if (n instanceof BigInteger b) return b;
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return BigInteger.valueOf(n.longValue());
        }
        throw new IllegalArgumentException("integer coefficient expected, got " + n);
    }
}
