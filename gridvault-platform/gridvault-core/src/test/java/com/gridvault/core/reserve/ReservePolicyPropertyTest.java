package com.gridvault.core.reserve;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEvent;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.ledger.AssetLedger;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerClock;
import com.gridvault.core.runtime.LedgerRuntime;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the reserve band and its sweep.
 */
class ReservePolicyPropertyTest {

    private static final Address WITHDRAW = Address.of("0x00000000000000000000000000000000000000aa");
    private static final ReserveParameters DEFAULTS = new ReserveParameters(
            ReservePolicy.DEFAULT_MIN_COEF, ReservePolicy.DEFAULT_MAX_COEF, BigInteger.ZERO, WITHDRAW);

    // ==================== Band evaluation ====================

    @Test
    void balanceAtUpperBoundIsNotSwept() {
        SweepPlan plan = ReservePolicy.plan(BigInteger.valueOf(120), BigInteger.valueOf(100), DEFAULTS);

        assertThat(plan.upperBound()).isEqualTo(BigInteger.valueOf(120));
        assertThat(plan.sweepDue()).isFalse();
        assertThat(plan.surplus()).isZero();
    }

    @Test
    void balanceAboveUpperBoundIsSweptDownToMinimumReserve() {
        SweepPlan plan = ReservePolicy.plan(BigInteger.valueOf(121), BigInteger.valueOf(100), DEFAULTS);

        assertThat(plan.sweepDue()).isTrue();
        assertThat(plan.targetReserve()).isEqualTo(BigInteger.valueOf(110));
        assertThat(plan.surplus()).isEqualTo(BigInteger.valueOf(11));
    }

    @Test
    void absoluteMinimumDominatesSmallSystemBalance() {
        ReserveParameters params = new ReserveParameters(
                ReservePolicy.DEFAULT_MIN_COEF, ReservePolicy.DEFAULT_MAX_COEF, BigInteger.valueOf(30), WITHDRAW);

        SweepPlan small = ReservePolicy.plan(BigInteger.valueOf(100), BigInteger.ONE, params);
        assertThat(small.targetReserve()).isEqualTo(BigInteger.valueOf(31));
        assertThat(small.surplus()).isEqualTo(BigInteger.valueOf(69));

        SweepPlan ten = ReservePolicy.plan(BigInteger.valueOf(100), BigInteger.TEN, params);
        assertThat(ten.targetReserve()).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    void balanceBelowTargetIsNeverSwept() {
        ReserveParameters params = new ReserveParameters(
                ReservePolicy.DEFAULT_MIN_COEF, ReservePolicy.DEFAULT_MAX_COEF, BigInteger.valueOf(1000), WITHDRAW);

        // above the coefficient bound but below systemBalance + absoluteMin
        SweepPlan plan = ReservePolicy.plan(BigInteger.valueOf(500), BigInteger.valueOf(100), params);

        assertThat(plan.sweepDue()).isFalse();
    }

    @Property(tries = 200)
    void sweepNeverLeavesLessThanTarget(
            @ForAll @BigRange(min = "0", max = "1000000000000000000000") BigInteger balance,
            @ForAll @BigRange(min = "0", max = "1000000000000000000000") BigInteger systemBalance,
            @ForAll @BigRange(min = "0", max = "1000000000000000000") BigInteger absoluteMin,
            @ForAll("coefficientPairs") BigInteger[] coefficients) {
        // Property: balance - surplus == target whenever a sweep is due, and no sweep otherwise
        ReserveParameters params = new ReserveParameters(coefficients[0], coefficients[1], absoluteMin, WITHDRAW);

        SweepPlan plan = ReservePolicy.plan(balance, systemBalance, params);

        if (plan.sweepDue()) {
            assertThat(balance).isGreaterThan(plan.upperBound());
            assertThat(balance.subtract(plan.surplus())).isEqualTo(plan.targetReserve());
            assertThat(plan.targetReserve()).isGreaterThanOrEqualTo(systemBalance.add(absoluteMin));
        } else {
            assertThat(plan.surplus()).isZero();
        }
    }

    // ==================== Coefficient validation ====================

    @Test
    void coefficientsAreValidatedInOrder() {
        ReservePolicy policy = newPolicy(new LedgerRuntime(31337, new LedgerClock(1_700_000_000L)));

        assertThatThrownBy(() -> policy.setCoefficients(BigInteger.valueOf(10_000), BigInteger.valueOf(9_000)))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("MinCoefficientTooLow");
        assertThatThrownBy(() -> policy.setCoefficients(BigInteger.valueOf(11_000), BigInteger.valueOf(10_000)))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("MaxCoefficientTooLow");
        assertThatThrownBy(() -> policy.setCoefficients(BigInteger.valueOf(13_000), BigInteger.valueOf(12_000)))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("InvalidCoefficientOrder");

        assertThat(policy.minCoef()).isEqualTo(ReservePolicy.DEFAULT_MIN_COEF);
        assertThat(policy.maxCoef()).isEqualTo(ReservePolicy.DEFAULT_MAX_COEF);
    }

    @Property(tries = 100)
    void validCoefficientsAreAccepted(@ForAll("coefficientPairs") BigInteger[] coefficients) {
        ReservePolicy policy = newPolicy(new LedgerRuntime(31337, new LedgerClock(1_700_000_000L)));

        policy.setCoefficients(coefficients[0], coefficients[1]);

        assertThat(policy.minCoef()).isEqualTo(coefficients[0]);
        assertThat(policy.maxCoef()).isEqualTo(coefficients[1]);
    }

    @Test
    void equalCoefficientsAreAllowed() {
        ReservePolicy policy = newPolicy(new LedgerRuntime(31337, new LedgerClock(1_700_000_000L)));

        policy.setCoefficients(BigInteger.valueOf(15_000), BigInteger.valueOf(15_000));

        assertThat(policy.parameters(Address.NATIVE).minCoef()).isEqualTo(BigInteger.valueOf(15_000));
    }

    @Test
    void withdrawAddressCannotBeZero() {
        ReservePolicy policy = newPolicy(new LedgerRuntime(31337, new LedgerClock(1_700_000_000L)));

        assertThatThrownBy(() -> policy.setWithdrawAddress(Address.ZERO))
                .isInstanceOfSatisfying(VaultException.class,
                        e -> assertThat(e.error()).isEqualTo(VaultError.ZERO_ADDRESS));
    }

    // ==================== Sweep execution ====================

    @Test
    void rebalanceMovesSurplusToWithdrawAddress() {
        LedgerRuntime runtime = new LedgerRuntime(31337, new LedgerClock(1_700_000_000L));
        Address vault = runtime.deploy("Reserve");
        AssetLedger ledger = new AssetLedger(vault, runtime.custody());
        ReservePolicy policy = new ReservePolicy(vault, runtime.events(), WITHDRAW);
        runtime.custody().mint(Address.NATIVE, vault, BigInteger.valueOf(121));
        ledger.credit(Address.NATIVE, BigInteger.valueOf(121));

        SweepPlan plan = runtime.invoke(vault, Call.from(vault),
                () -> policy.rebalance(Address.NATIVE, BigInteger.valueOf(100), ledger));

        assertThat(plan.surplus()).isEqualTo(BigInteger.valueOf(11));
        assertThat(ledger.balanceOf(Address.NATIVE)).isEqualTo(BigInteger.valueOf(110));
        assertThat(runtime.custody().balanceOf(Address.NATIVE, WITHDRAW)).isEqualTo(BigInteger.valueOf(11));

        List<LedgerEvent> sweeps = runtime.events().events(vault, LedgerEventType.AUTO_WITHDRAWAL);
        assertThat(sweeps).hasSize(1);
        assertThat(sweeps.get(0).address("to")).isEqualTo(WITHDRAW);
        assertThat(sweeps.get(0).uint("amount")).isEqualTo(BigInteger.valueOf(11));
        assertThat(sweeps.get(0).uint("remaining")).isEqualTo(BigInteger.valueOf(110));
    }

    @Provide
    Arbitrary<BigInteger[]> coefficientPairs() {
        return Combinators.combine(
                Arbitraries.integers().between(10_001, 30_000),
                Arbitraries.integers().between(0, 20_000)
        ).as((min, spread) -> new BigInteger[]{BigInteger.valueOf(min), BigInteger.valueOf(min + spread)});
    }

    private static ReservePolicy newPolicy(LedgerRuntime runtime) {
        return new ReservePolicy(runtime.deploy("Reserve"), runtime.events(), WITHDRAW);
    }
}
