package com.klrdim.formula.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DominantWeightTest {

    @Test
    void repeatedLabelsAreMultiplicities() {
        DominantWeight w = DominantWeight.ofLabels(List.of(3, 1, 3));
        assertEquals(2, w.multiplicity(3));
        assertEquals(1, w.multiplicity(1));
        assertEquals(0, w.multiplicity(2));
        assertEquals(3, w.level());
        assertEquals("L_1 + 2*L_3", w.toString());
        assertEquals(w, DominantWeight.of(Map.of(1, 1, 3, 2, 5, 0)));
    }

    @Test
    void rejectsNegativeMultiplicity() {
        assertThrows(IllegalArgumentException.class, () -> DominantWeight.of(Map.of(1, -1)));
    }

    @Test
    void zeroWeight() {
        DominantWeight zero = DominantWeight.ofLabels(List.of());
        assertEquals("0", zero.toString());
        assertTrue(zero.labels().isEmpty());
        assertEquals(0, zero.level());
    }
}
