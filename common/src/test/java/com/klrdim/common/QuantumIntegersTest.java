package com.klrdim.common;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QuantumIntegersTest {

    @Test
    void bracketOfZeroIsZeroForEveryScalar() {
        for (int d = 1; d <= 4; d++) {
            assertTrue(QuantumIntegers.bracket(0, d).isZero(), "d=" + d);
        }
    }

    @Test
    void bracketIsOdd() {
        for (int d = 1; d <= 3; d++) {
            for (int m = 1; m <= 6; m++) {
                assertEquals(QuantumIntegers.bracket(m, d).negate(), QuantumIntegers.bracket(-m, d),
                        "m=" + m + " d=" + d);
            }
        }
    }

    @Test
    void smallBracketsMatchDefinition() {
        assertEquals(LaurentPolynomial.ONE, QuantumIntegers.bracket(1, 1));
        assertEquals(LaurentPolynomial.of(Map.of(1, 1, -1, 1)), QuantumIntegers.bracket(2, 1));
        assertEquals(LaurentPolynomial.of(Map.of(2, 1, 0, 1, -2, 1)), QuantumIntegers.bracket(3, 1));
        // [2] at q^2
        assertEquals(LaurentPolynomial.of(Map.of(2, 1, -2, 1)), QuantumIntegers.bracket(2, 2));
        // [3] at q^2
        assertEquals(LaurentPolynomial.of(Map.of(4, 1, 0, 1, -4, 1)), QuantumIntegers.bracket(3, 2));
    }

    @Test
    void bracketSpecialisesToIntegerAtQEqualsOne() {
        for (int m = -5; m <= 5; m++) {
            assertEquals(m, QuantumIntegers.bracket(m, 3).evaluateAtOne().intValueExact());
        }
    }

    @Test
    void powerIsLaurentMonomial() {
        assertEquals(LaurentPolynomial.q(-4), QuantumIntegers.power(2, -2));
        assertEquals(LaurentPolynomial.ONE, QuantumIntegers.power(3, 0));
    }

    @Test
    void nonPositiveScalarRejected() {
        assertThrows(IllegalArgumentException.class, () -> QuantumIntegers.bracket(2, 0));
        assertThrows(IllegalArgumentException.class, () -> QuantumIntegers.power(-1, 2));
    }

    @Test
    void mostNegativeIntOverflowsInsteadOfLooping() {
        assertThrows(ArithmeticException.class, () -> QuantumIntegers.bracket(Integer.MIN_VALUE, 1));
    }
}
