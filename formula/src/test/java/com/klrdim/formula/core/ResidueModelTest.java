package com.klrdim.formula.core;

import com.klrdim.common.InvalidVertexException;
import com.klrdim.common.LengthMismatchException;
import com.klrdim.common.Permutation;
import com.klrdim.quiver.Quiver;
import com.klrdim.quiver.StandardQuiverProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResidueModelTest {

    private final StandardQuiverProvider provider = new StandardQuiverProvider();

    @Test
    void exponentRowsForTypeB3() {
        Quiver b3 = provider.resolve("B3");
        ResidueModel m = ResidueModel.of(b3, DominantWeight.ofLabels(List.of(2)),
                List.of(2, 3, 3, 2, 1), null, null);

        assertArrayEquals(new int[]{0, 1, -1, 0, 1}, m.baselineShiftRow());
        assertArrayEquals(new int[]{1, 2, 0, 1, 2}, m.exponents(Permutation.identity(5)));
        assertArrayEquals(new int[]{1, 2, 2, 1, 2}, m.exponents(Permutation.of(0, 2, 1, 3, 4)));
        assertArrayEquals(new int[]{1, 0, -2, 1, 2}, m.exponents(Permutation.of(3, 1, 2, 0, 4)));
        assertArrayEquals(new int[]{1, 0, 0, 1, 2}, m.exponents(Permutation.of(3, 2, 1, 0, 4)));
    }

    @Test
    void exponentRowsForTypeB3WithTwoRedStrings() {
        Quiver b3 = provider.resolve("B3");
        ResidueModel m = ResidueModel.of(b3, DominantWeight.ofLabels(List.of(2, 3)),
                List.of(2, 3, 3, 2, 1), List.of(2, 3, 2, 3, 1), null);

        assertArrayEquals(new int[]{0, 2, 0, 0, 1}, m.baselineShiftRow());
        assertArrayEquals(new int[]{1, 1, 1, 1, 2}, m.exponents(Permutation.of(2, 1, 3, 0, 4)));
        assertArrayEquals(new int[]{1, 3, 1, 1, 2}, m.exponents(Permutation.of(2, 3, 1, 0, 4)));
    }

    @Test
    void exponentRowsForTypeD4AndAffineA2() {
        ResidueModel d4 = ResidueModel.of(provider.resolve("D4"), DominantWeight.ofLabels(List.of(2)),
                List.of(2, 3, 4, 1), null, null);
        assertArrayEquals(new int[]{0, 0, 0, 0}, d4.baselineShiftRow());

        ResidueModel a2 = ResidueModel.of(provider.resolve("A2~"), DominantWeight.ofLabels(List.of(0)),
                List.of(0, 1, 2), List.of(0, 2, 1), null);
        assertArrayEquals(new int[]{0, 0, 1}, a2.baselineShiftRow());
        assertArrayEquals(new int[]{1, 1, 1}, a2.exponents(Permutation.of(0, 2, 1)));
    }

    @Test
    void baseIsPrependedToBothSequences() {
        ResidueModel m = ResidueModel.of(provider.resolve("B3"), DominantWeight.ofLabels(List.of(2, 3)),
                List.of(3, 3, 2, 1), List.of(3, 2, 3, 1), List.of(2));

        assertEquals(List.of(2, 3, 3, 2, 1), m.bottom());
        assertEquals(List.of(2, 3, 2, 3, 1), m.top());
        assertEquals(1, m.baseLength());
        assertEquals(5, m.length());
    }

    @Test
    void topDefaultsToBottom() {
        ResidueModel m = ResidueModel.of(provider.resolve("A3"), DominantWeight.ofLabels(List.of(1)),
                List.of(1, 2), null, List.of());
        assertEquals(m.bottom(), m.top());
    }

    @Test
    void rejectsLengthMismatch() {
        Quiver a3 = provider.resolve("A3");
        assertThrows(LengthMismatchException.class, () -> ResidueModel.of(a3,
                DominantWeight.ofLabels(List.of(1)), List.of(1, 2), List.of(1), null));
    }

    @Test
    void rejectsLabelsOutsideTheIndexSet() {
        Quiver a3 = provider.resolve("A3");
        DominantWeight w = DominantWeight.ofLabels(List.of(1));

        assertEquals(4, assertThrows(InvalidVertexException.class,
                () -> ResidueModel.of(a3, w, List.of(1, 4), null, null)).getVertex());
        assertEquals(0, assertThrows(InvalidVertexException.class,
                () -> ResidueModel.of(a3, w, List.of(1), List.of(1), List.of(0))).getVertex());
        assertThrows(InvalidVertexException.class,
                () -> ResidueModel.of(a3, w, List.of(1), List.of(5), null));
        assertThrows(InvalidVertexException.class,
                () -> ResidueModel.of(a3, DominantWeight.ofLabels(List.of(7)), List.of(1), null, null));
    }
}
