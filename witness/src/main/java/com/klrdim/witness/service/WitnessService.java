package com.klrdim.witness.service;

import com.klrdim.common.Permutation;
import com.klrdim.quiver.Quiver;
import com.klrdim.witness.core.WitnessSpace;

import java.util.List;

public interface WitnessService {

    /**
     * Candidate space for the working sequences; the first {@code baseLength}
     * positions of both sequences are the shared base.
     */
    WitnessSpace space(Quiver quiver, List<Integer> bottom, List<Integer> top, int baseLength);

    /**
     * All admissible witnesses, lexicographic by one-line notation.
     *
     * @throws com.klrdim.common.WitnessLimitExceededException if the space is larger than the configured limit
     */
    List<Permutation> enumerate(Quiver quiver, List<Integer> bottom, List<Integer> top, int baseLength);
}
