package com.gridvault.core.ledger;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Latest unrefunded deposit per account and asset.
 *
 * Entries are snapshots: a new deposit replaces the previous amount, and a claim or
 * refund clears the entry rather than decrementing it.
 */
public class DepositBook extends JournaledState {

    private final Map<Entry, BigInteger> deposits = new HashMap<>();

    public BigInteger amountOf(Address account, Address asset) {
        return deposits.getOrDefault(new Entry(account, asset), BigInteger.ZERO);
    }

    public void record(Address account, Address asset, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Deposit amount must be non-negative");
        }
        Entry entry = new Entry(account, asset);
        journalEntry(deposits, entry);
        deposits.put(entry, amount);
    }

    public void clear(Address account, Address asset) {
        Entry entry = new Entry(account, asset);
        journalEntry(deposits, entry);
        deposits.remove(entry);
    }

    /**
     * Bounds a refund by the recorded deposit, then clears the record even if the refund is partial.
     *
     * @throws VaultException {@code InvalidRefundAmount} if the amount exceeds the record
     */
    public void consumeForRefund(Address account, Address asset, BigInteger amount) {
        BigInteger recorded = amountOf(account, asset);
        if (amount.compareTo(recorded) > 0) {
            throw new VaultException(VaultError.INVALID_REFUND_AMOUNT,
                    "refund " + amount + " exceeds recorded deposit " + recorded + " of " + account);
        }
        clear(account, asset);
    }

    private record Entry(Address account, Address asset) {
        Entry {
            if (account == null || asset == null) {
                throw new IllegalArgumentException("Account and asset cannot be null");
            }
        }
    }
}
