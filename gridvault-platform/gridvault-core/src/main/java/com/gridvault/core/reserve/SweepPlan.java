package com.gridvault.core.reserve;

import java.math.BigInteger;

/**
 * Outcome of evaluating a vault balance against its reserve band.
 *
 * @param upperBound    balance above which a sweep is due
 * @param targetReserve balance left behind by a sweep
 * @param surplus       amount to sweep; zero when no sweep is due
 */
public record SweepPlan(BigInteger upperBound, BigInteger targetReserve, BigInteger surplus) {

    public boolean sweepDue() {
        return surplus.signum() > 0;
    }
}
