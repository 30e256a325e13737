package com.gridvault.core.ledger;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.AssetCustody;
import com.gridvault.core.runtime.JournaledState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * A vault's own bookkeeping of what it holds, per asset.
 *
 * Every outgoing transfer is debited here before custody is asked to move the funds,
 * so a re-entrant call already sees the reduced balance.
 */
public class AssetLedger extends JournaledState {

    private static final Logger log = LoggerFactory.getLogger(AssetLedger.class);

    private final Address vault;
    private final AssetCustody custody;
    private final Map<Address, BigInteger> booked = new HashMap<>();

    public AssetLedger(Address vault, AssetCustody custody) {
        if (vault == null || custody == null) {
            throw new IllegalArgumentException("Vault and custody cannot be null");
        }
        this.vault = vault;
        this.custody = custody;
    }

    public BigInteger balanceOf(Address asset) {
        requireAsset(asset);
        return booked.getOrDefault(asset, BigInteger.ZERO);
    }

    public void credit(Address asset, BigInteger amount) {
        requireAsset(asset);
        requireNonNegative(amount);
        journalEntry(booked, asset);
        booked.merge(asset, amount, BigInteger::add);
    }

    /**
     * @throws VaultException {@code InsufficientBalance} if the amount exceeds the booked balance
     */
    public void debit(Address asset, BigInteger amount) {
        requireAsset(asset);
        requireNonNegative(amount);
        BigInteger balance = balanceOf(asset);
        if (amount.compareTo(balance) > 0) {
            throw new VaultException(VaultError.INSUFFICIENT_BALANCE,
                    "balance " + balance + " of " + asset + " cannot cover " + amount);
        }
        journalEntry(booked, asset);
        booked.put(asset, balance.subtract(amount));
    }

    /**
     * Debits the ledger then pays {@code to}. A failing native payout is reported as
     * {@code EthTransferFailed}.
     */
    public void transferOut(Address asset, Address to, BigInteger amount) {
        if (to == null || to.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "recipient cannot be the zero address");
        }
        if (amount == null || amount.signum() == 0) {
            throw new VaultException(VaultError.ZERO_VALUE, "transfer amount cannot be zero");
        }
        debit(asset, amount);
        if (!asset.isZero()) {
            custody.transfer(asset, vault, to, amount);
            return;
        }
        try {
            custody.transfer(asset, vault, to, amount);
        } catch (RuntimeException e) {
            throw new VaultException(VaultError.ETH_TRANSFER_FAILED,
                    "native payout of " + amount + " to " + to + " failed", e);
        }
    }

    /**
     * Pulls tokens the payer has approved to the vault and books them.
     */
    public void pullFrom(Address token, Address payer, BigInteger amount) {
        if (token == null || token.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "token cannot be the zero address");
        }
        custody.transferFrom(token, vault, payer, vault, amount);
        credit(token, amount);
    }

    /**
     * Compares booked balance against what custody says the vault really holds.
     */
    public BalanceDrift reconcile(Address asset) {
        return new BalanceDrift(asset, balanceOf(asset), custody.balanceOf(asset, vault));
    }

    /**
     * Books custody the ledger does not know about, e.g. tokens sent straight to the vault.
     *
     * @return amount newly booked
     */
    public BigInteger absorbSurplus(Address asset) {
        BalanceDrift drift = reconcile(asset);
        if (drift.surplus().signum() <= 0) {
            return BigInteger.ZERO;
        }
        credit(asset, drift.surplus());
        log.info("Booked {} untracked units of {} held by {}", drift.surplus(), asset, vault);
        return drift.surplus();
    }

    public Address vault() {
        return vault;
    }

    private static void requireAsset(Address asset) {
        if (asset == null) {
            throw new IllegalArgumentException("Asset cannot be null");
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
    }
}
