package com.klrdim.common;

import java.math.BigInteger;

/** The witness set is larger than the configured enumeration limit. */
public class WitnessLimitExceededException extends IllegalStateException {

    private final BigInteger witnessCount;

    public WitnessLimitExceededException(BigInteger witnessCount, long limit) {
        super("witness count " + witnessCount + " exceeds enumeration limit " + limit);
        this.witnessCount = witnessCount;
    }

    public BigInteger getWitnessCount() {
        return witnessCount;
    }
}
