package com.gridvault.core.ledger;

import com.gridvault.core.model.Address;

import java.math.BigInteger;

/**
 * Booked versus custodied balance of one asset.
 */
public record BalanceDrift(Address asset, BigInteger booked, BigInteger custodied) {

    /**
     * Custody the ledger does not account for. Negative means the ledger promises more than it holds.
     */
    public BigInteger surplus() {
        return custodied.subtract(booked);
    }

    public boolean isBalanced() {
        return surplus().signum() == 0;
    }

    public boolean isUnderfunded() {
        return surplus().signum() < 0;
    }
}
