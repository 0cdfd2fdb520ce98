package com.klrdim.witness.service;

import com.klrdim.common.Permutation;
import com.klrdim.common.WitnessLimitExceededException;
import com.klrdim.config.KlrConfig;
import com.klrdim.quiver.Quiver;
import com.klrdim.witness.core.BaseTranspositions;
import com.klrdim.witness.core.WitnessEnumerator;
import com.klrdim.witness.core.WitnessSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * WitnessServiceImpl
 *
 * - base orbits from the base transpositions, or a frozen prefix when
 *   {@code enumeration.baseTranspositions} is off
 * - refuses spaces above {@code enumeration.maxWitnesses} before enumerating
 */
public final class WitnessServiceImpl implements WitnessService {

    private static final Logger logger = LoggerFactory.getLogger(WitnessServiceImpl.class);

    private final KlrConfig cfg;

    public WitnessServiceImpl(KlrConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public WitnessSpace space(Quiver quiver, List<Integer> bottom, List<Integer> top, int baseLength) {
        Objects.requireNonNull(quiver, "quiver");
        List<Integer> base = bottom.subList(0, baseLength);
        int[] orbits = cfg.getEnumeration().isBaseTranspositions()
                ? BaseTranspositions.orbits(base, quiver)
                : BaseTranspositions.frozen(baseLength);
        return WitnessSpace.of(bottom, top, baseLength, orbits);
    }

    @Override
    public List<Permutation> enumerate(Quiver quiver, List<Integer> bottom, List<Integer> top, int baseLength) {
        WitnessSpace space = space(quiver, bottom, top, baseLength);

        long limit = cfg.getEnumeration().getMaxWitnesses();
        BigInteger count = space.count();
        if (count.compareTo(BigInteger.valueOf(limit)) > 0) {
            throw new WitnessLimitExceededException(count, limit);
        }
        if (baseLength > 0) {
            logger.warn("Base prefix of length {} restricts the witness group; "
                    + "witnesses moving base positions across orbits are omitted", baseLength);
        }

        List<Permutation> witnesses = WitnessEnumerator.enumerate(space);
        logger.debug("Enumerated {} witnesses for n={} (base={})", witnesses.size(), space.length(), baseLength);
        if (logger.isTraceEnabled()) {
            for (Permutation w : witnesses) logger.trace("witness {}", w.toOneLineString());
        }
        return witnesses;
    }
}
