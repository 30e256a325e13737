package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.access.RoleGate;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEvent;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.ledger.AssetLedger;
import com.gridvault.core.ledger.BalanceDrift;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.Journaled;
import com.gridvault.core.runtime.LedgerRuntime;

import java.math.BigInteger;
import java.util.List;
import java.util.function.Supplier;

/**
 * Base of every vault: an address, a role gate and an asset ledger, all running on a
 * {@link LedgerRuntime}.
 *
 * Subclasses wrap each mutating entry point in {@link #invoke} or {@link #execute} so a
 * rejected call leaves no trace.
 */
public abstract class AbstractVault {

    protected final LedgerRuntime runtime;
    protected final Address address;
    protected final RoleGate roles;
    protected final AssetLedger ledger;

    protected AbstractVault(LedgerRuntime runtime, String name, Address admin) {
        if (runtime == null) {
            throw new IllegalArgumentException("Runtime cannot be null");
        }
        requireNonZero(admin, "admin");
        this.runtime = runtime;
        this.address = runtime.deploy(name);
        this.roles = track(new RoleGate(address, runtime.events()));
        this.ledger = track(new AssetLedger(address, runtime.custody()));
        roles.grant(Role.DEFAULT_ADMIN, admin, admin);
    }

    public Address address() {
        return address;
    }

    public boolean hasRole(Role role, Address account) {
        return roles.hasRole(role, account);
    }

    public void grantRole(Call call, Role role, Address account) {
        execute(call, () -> roles.grantRole(call.caller(), role, account));
    }

    public void revokeRole(Call call, Role role, Address account) {
        execute(call, () -> roles.revokeRole(call.caller(), role, account));
    }

    public void renounceRole(Call call, Role role, Address confirmation) {
        execute(call, () -> roles.renounceRole(call.caller(), role, confirmation));
    }

    /**
     * Balance as booked by this vault.
     */
    public BigInteger bookedBalance(Address asset) {
        return ledger.balanceOf(asset);
    }

    public BalanceDrift reconcile(Address asset) {
        return ledger.reconcile(asset);
    }

    /**
     * Books custody that arrived without passing through the vault, e.g. a direct token transfer.
     */
    public BigInteger syncBalance(Call call, Address asset) {
        return invoke(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            BigInteger absorbed = ledger.absorbSurplus(asset);
            if (absorbed.signum() > 0) {
                emit(LedgerEventType.BALANCE_SYNCED, "token", asset, "amount", absorbed);
            }
            return absorbed;
        });
    }

    /**
     * Committed events emitted by this vault.
     */
    public List<LedgerEvent> events(LedgerEventType type) {
        return runtime.events().events(address, type);
    }

    protected <T extends Journaled> T track(T state) {
        runtime.register(state);
        return state;
    }

    protected <T> T invoke(Call call, Supplier<T> body) {
        return runtime.invoke(address, call, body);
    }

    protected void execute(Call call, Runnable body) {
        runtime.execute(address, call, body);
    }

    protected void emit(LedgerEventType type, Object... keyValues) {
        runtime.events().emit(type, address, keyValues);
    }

    protected long now() {
        return runtime.now();
    }

    /**
     * Books native value attached to the current call.
     */
    protected void bookAttachedValue(Call call) {
        if (call.hasValue()) {
            ledger.credit(Address.NATIVE, call.value());
        }
    }

    protected static Address requireNonZero(Address address, String what) {
        if (address == null || address.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, what + " cannot be the zero address");
        }
        return address;
    }

    protected static BigInteger requirePositive(BigInteger value, String what) {
        if (value == null || value.signum() == 0) {
            throw new VaultException(VaultError.ZERO_VALUE, what + " cannot be zero");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(what + " cannot be negative");
        }
        return value;
    }
}
