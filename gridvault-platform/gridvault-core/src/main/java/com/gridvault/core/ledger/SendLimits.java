package com.gridvault.core.ledger;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-asset ceiling on a single operator push transfer.
 * An unset limit is zero, which disables pushes of that asset entirely.
 */
public class SendLimits extends JournaledState {

    private final Map<Address, BigInteger> limits = new HashMap<>();

    public BigInteger limitOf(Address asset) {
        return limits.getOrDefault(asset, BigInteger.ZERO);
    }

    public void setLimit(Address asset, BigInteger limit) {
        if (asset == null) {
            throw new IllegalArgumentException("Asset cannot be null");
        }
        if (limit == null || limit.signum() < 0) {
            throw new IllegalArgumentException("Limit must be non-negative");
        }
        journalEntry(limits, asset);
        limits.put(asset, limit);
    }

    /**
     * @throws VaultException {@code ExceedsTokenLimit} if the amount is above the asset's limit
     */
    public void check(Address asset, BigInteger amount) {
        BigInteger limit = limitOf(asset);
        if (amount.compareTo(limit) > 0) {
            throw new VaultException(VaultError.EXCEEDS_TOKEN_LIMIT,
                    "amount " + amount + " of " + asset + " exceeds limit " + limit);
        }
    }
}
