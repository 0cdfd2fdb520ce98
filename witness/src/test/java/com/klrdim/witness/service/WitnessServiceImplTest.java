package com.klrdim.witness.service;

import com.klrdim.common.Permutation;
import com.klrdim.common.WitnessLimitExceededException;
import com.klrdim.config.KlrConfig;
import com.klrdim.quiver.Quiver;
import com.klrdim.quiver.StandardQuiverProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WitnessServiceImplTest {

    @Mock
    private KlrConfig cfg;

    private final KlrConfig.EnumerationConfig enumeration = new KlrConfig.EnumerationConfig();
    private final Quiver a3 = new StandardQuiverProvider().resolve("A3");

    @BeforeEach
    void setUp() {
        when(cfg.getEnumeration()).thenReturn(enumeration);
    }

    @Test
    void baseTranspositionsWidenTheBaseOrbit() {
        List<Integer> seq = List.of(1, 3, 1, 2);

        List<Permutation> widened = new WitnessServiceImpl(cfg).enumerate(a3, seq, seq, 3);
        assertEquals(2, widened.size());

        enumeration.baseTranspositions = false;
        List<Permutation> frozen = new WitnessServiceImpl(cfg).enumerate(a3, seq, seq, 3);
        assertEquals(List.of(Permutation.identity(4)), frozen);
    }

    @Test
    void refusesSpacesAboveTheLimit() {
        enumeration.maxWitnesses = 5;
        List<Integer> seq = List.of(1, 1, 1);

        WitnessLimitExceededException ex = assertThrows(WitnessLimitExceededException.class,
                () -> new WitnessServiceImpl(cfg).enumerate(a3, seq, seq, 0));
        assertEquals(BigInteger.valueOf(6), ex.getWitnessCount());
    }

    @Test
    void spaceReportsExactCount() {
        List<Integer> bottom = List.of(2, 3, 3, 2, 1);
        List<Integer> top = List.of(2, 3, 2, 3, 1);
        assertEquals(BigInteger.valueOf(4), new WitnessServiceImpl(cfg).space(a3, bottom, top, 0).count());
    }
}
