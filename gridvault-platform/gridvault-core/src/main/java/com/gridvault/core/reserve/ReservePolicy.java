package com.gridvault.core.reserve;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.EventLog;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.ledger.AssetLedger;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Auto-rebalancer that keeps custody within a band around the off-chain system balance.
 *
 * After a deposit, if the vault holds more than {@code systemBalance * maxCoef / 10000},
 * everything above {@code max(systemBalance * minCoef / 10000, systemBalance + absoluteMin)}
 * is swept to the withdraw address.
 */
public class ReservePolicy extends JournaledState {

    private static final Logger log = LoggerFactory.getLogger(ReservePolicy.class);

    public static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);
    public static final BigInteger DEFAULT_MIN_COEF = BigInteger.valueOf(11_000);
    public static final BigInteger DEFAULT_MAX_COEF = BigInteger.valueOf(12_000);

    private final Address vault;
    private final EventLog events;
    private BigInteger minCoef = DEFAULT_MIN_COEF;
    private BigInteger maxCoef = DEFAULT_MAX_COEF;
    private Address withdrawAddress;
    private final Map<Address, BigInteger> absoluteMins = new HashMap<>();

    public ReservePolicy(Address vault, EventLog events, Address withdrawAddress) {
        if (vault == null || events == null) {
            throw new IllegalArgumentException("Vault and event log cannot be null");
        }
        requireNonZero(withdrawAddress);
        this.vault = vault;
        this.events = events;
        this.withdrawAddress = withdrawAddress;
    }

    /**
     * Pure band evaluation.
     */
    public static SweepPlan plan(BigInteger vaultBalance, BigInteger systemBalance, ReserveParameters params) {
        if (vaultBalance == null || systemBalance == null || params == null) {
            throw new IllegalArgumentException("Balances and parameters cannot be null");
        }
        BigInteger upperBound = systemBalance.multiply(params.maxCoef()).divide(BASIS_POINTS);
        BigInteger coefficientReserve = systemBalance.multiply(params.minCoef()).divide(BASIS_POINTS);
        BigInteger target = coefficientReserve.max(systemBalance.add(params.absoluteMin()));
        if (vaultBalance.compareTo(upperBound) <= 0 || vaultBalance.compareTo(target) <= 0) {
            return new SweepPlan(upperBound, target, BigInteger.ZERO);
        }
        return new SweepPlan(upperBound, target, vaultBalance.subtract(target));
    }

    /**
     * Sweeps the surplus of {@code asset} if its booked balance is above the band.
     *
     * @return the executed plan
     */
    public SweepPlan rebalance(Address asset, BigInteger systemBalance, AssetLedger ledger) {
        BigInteger balance = ledger.balanceOf(asset);
        SweepPlan plan = plan(balance, systemBalance, parameters(asset));
        if (!plan.sweepDue()) {
            return plan;
        }
        ledger.transferOut(asset, withdrawAddress, plan.surplus());
        events.emit(LedgerEventType.AUTO_WITHDRAWAL, vault,
                "to", withdrawAddress, "token", asset, "amount", plan.surplus(),
                "systemBalance", systemBalance, "remaining", plan.targetReserve());
        log.info("Swept {} of {} from {} to {}, {} left against system balance {}",
                plan.surplus(), asset, vault, withdrawAddress, plan.targetReserve(), systemBalance);
        return plan;
    }

    /**
     * Validates and sets both coefficients. The checks run in a fixed order: min, max, then their order.
     */
    public void setCoefficients(BigInteger newMinCoef, BigInteger newMaxCoef) {
        if (newMinCoef == null || newMaxCoef == null) {
            throw new IllegalArgumentException("Coefficients cannot be null");
        }
        if (newMinCoef.compareTo(BASIS_POINTS) <= 0) {
            throw new VaultException(VaultError.MIN_COEFFICIENT_TOO_LOW,
                    "min coefficient " + newMinCoef + " must exceed " + BASIS_POINTS);
        }
        if (newMaxCoef.compareTo(BASIS_POINTS) <= 0) {
            throw new VaultException(VaultError.MAX_COEFFICIENT_TOO_LOW,
                    "max coefficient " + newMaxCoef + " must exceed " + BASIS_POINTS);
        }
        if (newMinCoef.compareTo(newMaxCoef) > 0) {
            throw new VaultException(VaultError.INVALID_COEFFICIENT_ORDER,
                    "min coefficient " + newMinCoef + " above max " + newMaxCoef);
        }
        BigInteger previousMin = minCoef;
        BigInteger previousMax = maxCoef;
        onUndo(() -> {
            minCoef = previousMin;
            maxCoef = previousMax;
        });
        minCoef = newMinCoef;
        maxCoef = newMaxCoef;
        log.info("Reserve coefficients of {} set to {}..{}", vault, newMinCoef, newMaxCoef);
    }

    public void setAbsoluteMin(Address asset, BigInteger amount) {
        if (asset == null) {
            throw new IllegalArgumentException("Asset cannot be null");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Absolute minimum must be non-negative");
        }
        journalEntry(absoluteMins, asset);
        absoluteMins.put(asset, amount);
    }

    public void setWithdrawAddress(Address newWithdrawAddress) {
        requireNonZero(newWithdrawAddress);
        Address previous = withdrawAddress;
        onUndo(() -> withdrawAddress = previous);
        withdrawAddress = newWithdrawAddress;
        events.emit(LedgerEventType.WITHDRAW_ADDRESS_UPDATED, vault,
                "previous", previous, "withdrawAddress", newWithdrawAddress);
    }

    public ReserveParameters parameters(Address asset) {
        return new ReserveParameters(minCoef, maxCoef, absoluteMin(asset), withdrawAddress);
    }

    public BigInteger minCoef() {
        return minCoef;
    }

    public BigInteger maxCoef() {
        return maxCoef;
    }

    public BigInteger absoluteMin(Address asset) {
        return absoluteMins.getOrDefault(asset, BigInteger.ZERO);
    }

    public Address withdrawAddress() {
        return withdrawAddress;
    }

    private static void requireNonZero(Address address) {
        if (address == null || address.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "withdraw address cannot be the zero address");
        }
    }
}
