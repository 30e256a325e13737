package com.gridvault.core.vesting;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.JournaledState;
import com.gridvault.core.runtime.LedgerRuntime;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Voting-escrow style lock book. Each lock is a numbered position owned by its beneficiary.
 */
public class LockingEscrow extends JournaledState implements TimeLockEscrow {

    private static final long WEEK = 7 * 24 * 60 * 60L;

    private final LedgerRuntime runtime;
    private final Address address;
    private final Address token;
    private final Map<BigInteger, Lock> locks = new HashMap<>();
    private BigInteger lastId = BigInteger.ZERO;

    public LockingEscrow(LedgerRuntime runtime, Address token) {
        if (runtime == null) {
            throw new IllegalArgumentException("Runtime cannot be null");
        }
        if (token == null || token.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "locked token cannot be the zero address");
        }
        this.runtime = runtime;
        this.token = token;
        this.address = runtime.deploy("LockingEscrow");
        runtime.register(this);
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Address lockedToken() {
        return token;
    }

    @Override
    public BigInteger createLockFor(Address funder, Address beneficiary, BigInteger amount, long durationSeconds) {
        return runtime.invoke(address, Call.from(funder), () -> {
            if (beneficiary == null || beneficiary.isZero()) {
                throw new VaultException(VaultError.ZERO_ADDRESS, "lock beneficiary cannot be the zero address");
            }
            if (amount == null || amount.signum() == 0) {
                throw new VaultException(VaultError.ZERO_VALUE, "lock amount cannot be zero");
            }
            if (durationSeconds <= 0) {
                throw new IllegalArgumentException("Lock duration must be positive");
            }
            runtime.custody().transferFrom(token, address, funder, address, amount);
            // Unlock times round down to a whole week
            long unlockTime = (runtime.now() + durationSeconds) / WEEK * WEEK;
            BigInteger previousId = lastId;
            onUndo(() -> lastId = previousId);
            lastId = lastId.add(BigInteger.ONE);
            journalEntry(locks, lastId);
            locks.put(lastId, new Lock(lastId, beneficiary, amount, unlockTime));
            runtime.events().emit(LedgerEventType.LOCK_CREATED, address,
                    "tokenId", lastId, "owner", beneficiary, "amount", amount, "unlockTime", unlockTime);
            return lastId;
        });
    }

    public Optional<Lock> lock(BigInteger tokenId) {
        return Optional.ofNullable(locks.get(tokenId));
    }

    public Optional<Address> ownerOf(BigInteger tokenId) {
        return lock(tokenId).map(Lock::owner);
    }

    public int lockCount() {
        return locks.size();
    }

    /**
     * An open lock position.
     */
    public record Lock(BigInteger tokenId, Address owner, BigInteger amount, long unlockTime) {}
}
