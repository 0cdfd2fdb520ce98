package com.klrdim.api;

import com.klrdim.formula.core.DominantWeight;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputParsersTest {

    @Test
    void parsesSeparatedAndCompactSequences() {
        assertEquals(List.of(2, 3, 3, 2, 1), InputParsers.parseSequence("2,3,3,2,1"));
        assertEquals(List.of(2, 3, 3, 2, 1), InputParsers.parseSequence("2 3 3 2 1"));
        assertEquals(List.of(2, 3, 3, 2, 1), InputParsers.parseSequence("23321"));
        assertEquals(List.of(2, 3), InputParsers.parseSequence("[2, 3]"));
        assertEquals(List.of(10, 2), InputParsers.parseSequence("10,2"));
        assertEquals(List.of(), InputParsers.parseSequence(""));
        assertEquals(List.of(), InputParsers.parseSequence("[]"));
    }

    @Test
    void rejectsNonLabels() {
        assertThrows(IllegalArgumentException.class, () -> InputParsers.parseSequence("1,a"));
        assertThrows(IllegalArgumentException.class, () -> InputParsers.parseSequence("1,-2"));
        assertThrows(IllegalArgumentException.class, () -> InputParsers.parseSequence(null));
    }

    @Test
    void weightsRepeatLabels() {
        DominantWeight w = InputParsers.parseWeight("1,1");
        assertEquals(2, w.multiplicity(1));
        assertEquals(DominantWeight.ofLabels(List.of(2, 3)), InputParsers.parseWeight("23"));
    }
}
