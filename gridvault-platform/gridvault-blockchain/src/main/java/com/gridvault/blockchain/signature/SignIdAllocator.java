package com.gridvault.blockchain.signature;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out strictly increasing signIds per scope, so vaults that track a watermark
 * keep advancing it. A scope is usually the vault address, or vault and token.
 */
public class SignIdAllocator {

    private final Map<String, AtomicLong> lastIssued = new ConcurrentHashMap<>();

    public BigInteger allocate(String scope) {
        return BigInteger.valueOf(counter(scope).incrementAndGet());
    }

    /**
     * Moves the scope past an id seen elsewhere, e.g. one already redeemed on the ledger.
     */
    public void advancePast(String scope, BigInteger signId) {
        if (signId == null || signId.signum() < 0) {
            throw new IllegalArgumentException("SignId must be non-negative: " + signId);
        }
        long floor = signId.longValueExact();
        counter(scope).accumulateAndGet(floor, Math::max);
    }

    public BigInteger lastIssued(String scope) {
        AtomicLong counter = lastIssued.get(scope);
        return counter == null ? BigInteger.ZERO : BigInteger.valueOf(counter.get());
    }

    private AtomicLong counter(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Scope cannot be null or blank");
        }
        return lastIssued.computeIfAbsent(scope, s -> new AtomicLong());
    }
}
