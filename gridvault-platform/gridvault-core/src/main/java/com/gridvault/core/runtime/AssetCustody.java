package com.gridvault.core.runtime;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Real holdings of every address: native currency plus ERC20-style tokens with allowances.
 *
 * This is what vault bookkeeping reconciles against. Native transfers to an address
 * with a registered {@link ReceiveHook} run that hook, which may call back into vaults.
 */
public class AssetCustody extends JournaledState {

    private final LedgerRuntime runtime;
    private final Map<Address, Map<Address, BigInteger>> balances = new HashMap<>();
    private final Map<Address, Map<Address, Map<Address, BigInteger>>> allowances = new HashMap<>();
    private final Map<Address, ReceiveHook> receivers = new HashMap<>();

    AssetCustody(LedgerRuntime runtime) {
        this.runtime = runtime;
    }

    public BigInteger balanceOf(Address asset, Address holder) {
        return balances.getOrDefault(asset, Map.of()).getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Creates new units of an asset out of thin air. Used to fund accounts.
     */
    public void mint(Address asset, Address to, BigInteger amount) {
        requirePositive(amount);
        if (to == null || to.isZero()) {
            throw new IllegalArgumentException("Mint recipient cannot be the zero address");
        }
        credit(asset, to, amount);
    }

    public void burn(Address asset, Address from, BigInteger amount) {
        requirePositive(amount);
        debit(asset, from, amount);
    }

    public void approve(Address token, Address owner, Address spender, BigInteger amount) {
        if (token == null || token.isZero()) {
            throw new IllegalArgumentException("Allowances apply to tokens only");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Allowance must be non-negative");
        }
        Map<Address, BigInteger> spenders = allowances.computeIfAbsent(token, k -> new HashMap<>())
                .computeIfAbsent(owner, k -> new HashMap<>());
        journalEntry(spenders, spender);
        spenders.put(spender, amount);
    }

    public BigInteger allowance(Address token, Address owner, Address spender) {
        return allowances.getOrDefault(token, Map.of())
                .getOrDefault(owner, Map.of())
                .getOrDefault(spender, BigInteger.ZERO);
    }

    /**
     * Moves an asset. Native transfers trigger the recipient's receive hook after the move.
     */
    public void transfer(Address asset, Address from, Address to, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        if (to == null || to.isZero()) {
            throw new VaultException(failureFor(asset), "transfer to the zero address");
        }
        debit(asset, from, amount);
        credit(asset, to, amount);
        if (asset.isZero()) {
            ReceiveHook hook = receivers.get(to);
            if (hook != null) {
                runtime.execute(to, Call.from(from), () -> hook.onReceive(from, amount));
            }
        }
    }

    /**
     * Moves tokens on behalf of {@code from}, spending the spender's allowance.
     */
    public void transferFrom(Address token, Address spender, Address from, Address to, BigInteger amount) {
        if (token == null || token.isZero()) {
            throw new IllegalArgumentException("transferFrom applies to tokens only");
        }
        BigInteger allowed = allowance(token, from, spender);
        if (allowed.compareTo(amount) < 0) {
            throw new VaultException(VaultError.TRANSFER_FAILED,
                    "insufficient allowance " + allowed + " for " + amount);
        }
        approve(token, from, spender, allowed.subtract(amount));
        transfer(token, from, to, amount);
    }

    public void registerReceiver(Address address, ReceiveHook hook) {
        if (address == null || hook == null) {
            throw new IllegalArgumentException("Address and hook cannot be null");
        }
        receivers.put(address, hook);
    }

    public void removeReceiver(Address address) {
        receivers.remove(address);
    }

    private void credit(Address asset, Address holder, BigInteger amount) {
        Map<Address, BigInteger> holders = balances.computeIfAbsent(asset, k -> new HashMap<>());
        journalEntry(holders, holder);
        holders.merge(holder, amount, BigInteger::add);
    }

    private void debit(Address asset, Address holder, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        BigInteger held = balanceOf(asset, holder);
        if (held.compareTo(amount) < 0) {
            throw new VaultException(failureFor(asset),
                    holder + " holds " + held + " of " + asset + ", needs " + amount);
        }
        Map<Address, BigInteger> holders = balances.get(asset);
        journalEntry(holders, holder);
        holders.put(holder, held.subtract(amount));
    }

    private static VaultError failureFor(Address asset) {
        return asset.isZero() ? VaultError.ETH_TRANSFER_FAILED : VaultError.TRANSFER_FAILED;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
