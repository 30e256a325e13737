package com.gridvault.core.runtime;

import com.gridvault.core.model.Address;

import java.math.BigInteger;

/**
 * Who is calling and how much native currency is attached.
 */
public record Call(Address caller, BigInteger value) {

    public Call {
        if (caller == null) {
            throw new IllegalArgumentException("Caller cannot be null");
        }
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Attached value must be non-negative");
        }
    }

    public static Call from(Address caller) {
        return new Call(caller, BigInteger.ZERO);
    }

    public Call withValue(BigInteger amount) {
        return new Call(caller, amount);
    }

    public Call withValue(long amount) {
        return withValue(BigInteger.valueOf(amount));
    }

    public boolean hasValue() {
        return value.signum() > 0;
    }
}
