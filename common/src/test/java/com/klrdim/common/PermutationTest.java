package com.klrdim.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PermutationTest {

    @Test
    void cycleNotationMatchesTraceFormat() {
        assertEquals("()", Permutation.identity(5).toCycleString());
        assertEquals("(1,2)", Permutation.of(0, 2, 1, 3, 4).toCycleString());
        assertEquals("(0,3)(1,2)", Permutation.of(3, 2, 1, 0, 4).toCycleString());
        assertEquals("(0,2,1,3)", Permutation.of(2, 3, 1, 0, 4).toCycleString());
    }

    @Test
    void lengthCountsInversions() {
        assertEquals(0, Permutation.identity(4).length());
        assertEquals(1, Permutation.of(1, 0, 2).length());
        assertEquals(6, Permutation.of(3, 2, 1, 0).length());
    }

    @Test
    void oneLineNotationListsImages() {
        Permutation w = Permutation.of(2, 3, 1, 0, 4);
        assertEquals("[2, 3, 1, 0, 4]", w.toOneLineString());
        assertEquals(3, w.apply(1));
        assertEquals(5, w.size());
        assertEquals("[]", Permutation.identity(0).toOneLineString());
    }

    @Test
    void rejectsNonBijection() {
        assertThrows(IllegalArgumentException.class, () -> Permutation.of(0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> Permutation.of(0, 3));
    }

    @Test
    void equalityIsByImages() {
        assertEquals(Permutation.of(1, 0), Permutation.of(1, 0));
        assertEquals(Permutation.of(1, 0).hashCode(), Permutation.of(1, 0).hashCode());
        assertNotEquals(Permutation.of(1, 0), Permutation.identity(2));
    }
}
