package com.gridvault.core.vesting;

import com.gridvault.core.model.Address;

import java.math.BigInteger;

/**
 * External component that locks tokens for a beneficiary until a future time.
 */
public interface TimeLockEscrow {

    /**
     * Address the funder must approve before calling {@link #createLockFor}.
     */
    Address address();

    Address lockedToken();

    /**
     * Pulls {@code amount} of the locked token from {@code funder} and opens a position.
     *
     * @return id of the new position, starting at 1
     */
    BigInteger createLockFor(Address funder, Address beneficiary, BigInteger amount, long durationSeconds);
}
