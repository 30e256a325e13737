package com.gridvault.core.replay;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.UndoLog;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for single-use identifiers and the signId watermark.
 */
class ReplayGuardPropertyTest {

    private static final Address TOKEN_A = Address.of("0x000000000000000000000000000000000000a001");
    private static final Address TOKEN_B = Address.of("0x000000000000000000000000000000000000b001");

    // ==================== Single use ====================

    @Property(tries = 100)
    void identifierIsAcceptedExactlyOnce(@ForAll("identifiers") BigInteger id) {
        // Property: the second markUsed of any id fails with the configured replay error
        ReplayGuard guard = new ReplayGuard(VaultError.ORDER_ALREADY_PROCESSED);

        guard.markUsed(id);

        assertThat(guard.isUsed(id)).isTrue();
        assertThatThrownBy(() -> guard.markUsed(id))
                .isInstanceOfSatisfying(VaultException.class,
                        e -> assertThat(e.error()).isEqualTo(VaultError.ORDER_ALREADY_PROCESSED));
        assertThat(guard.size()).isEqualTo(1);
    }

    @Property(tries = 100)
    void distinctIdentifiersDoNotInterfere(@ForAll @Size(min = 1, max = 50) Set<@BigRange(min = "0", max = "1000000") BigInteger> ids) {
        ReplayGuard guard = new ReplayGuard(VaultError.SIGN_ID_ALREADY_USED);

        ids.forEach(guard::markUsed);

        assertThat(guard.size()).isEqualTo(ids.size());
        ids.forEach(id -> assertThat(guard.isUsed(id)).isTrue());
    }

    @Property(tries = 100)
    void scopesAreIndependent(@ForAll("identifiers") BigInteger id) {
        ReplayGuard guard = new ReplayGuard(VaultError.ORDER_ALREADY_PROCESSED);

        guard.markUsed(TOKEN_A, id);

        assertThat(guard.isUsed(TOKEN_A, id)).isTrue();
        assertThat(guard.isUsed(TOKEN_B, id)).isFalse();
        assertThat(guard.isUsed(id)).isFalse();
        guard.markUsed(TOKEN_B, id);
        assertThat(guard.isUsed(TOKEN_B, id)).isTrue();
    }

    @Test
    void rollbackForgetsConsumedIdentifiers() {
        ReplayGuard guard = new ReplayGuard(VaultError.ID_USED);
        guard.markUsed(BigInteger.ONE);

        UndoLog log = new UndoLog();
        guard.attach(log);
        int mark = log.begin();
        guard.markUsed(BigInteger.TWO);
        log.rollback(mark);

        assertThat(guard.isUsed(BigInteger.ONE)).isTrue();
        assertThat(guard.isUsed(BigInteger.TWO)).isFalse();
    }

    @Test
    void consumingAnIdJournalsOneEntryRegardlessOfHistory() {
        ReplayGuard guard = new ReplayGuard(VaultError.ID_USED);
        for (int i = 0; i < 10_000; i++) {
            guard.markUsed(BigInteger.valueOf(i));
        }
        UndoLog log = new UndoLog();
        guard.attach(log);

        int mark = log.begin();
        guard.markUsed(BigInteger.valueOf(10_000));

        assertThat(log.pending()).isEqualTo(1);
        log.rollback(mark);
        assertThat(guard.size()).isEqualTo(10_000);
    }

    @Test
    void rejectedReuseJournalsNothing() {
        ReplayGuard guard = new ReplayGuard(VaultError.ID_USED);
        guard.markUsed(BigInteger.ONE);
        UndoLog log = new UndoLog();
        guard.attach(log);

        int mark = log.begin();
        assertThatThrownBy(() -> guard.markUsed(BigInteger.ONE)).isInstanceOf(VaultException.class);

        assertThat(log.pending()).isZero();
        log.commit(mark);
    }

    @Test
    void guardRequiresReplayError() {
        assertThatThrownBy(() -> new ReplayGuard(VaultError.WRONG_SIGNATURE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReplayGuard(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Watermark ====================

    @Property(tries = 100)
    void watermarkIsMaximumOfAcceptedIds(@ForAll @Size(min = 1, max = 30) List<@BigRange(min = "0", max = "1000") BigInteger> ids) {
        // Property: last() equals the maximum id seen, and advance() answers true only for new maxima
        SignIdWatermark watermark = new SignIdWatermark();
        BigInteger max = BigInteger.ZERO;

        for (BigInteger id : ids) {
            boolean advanced = watermark.advance(TOKEN_A, id);
            assertThat(advanced).isEqualTo(id.compareTo(max) > 0);
            max = max.max(id);
        }

        assertThat(watermark.last(TOKEN_A)).isEqualTo(max);
        assertThat(watermark.last(TOKEN_B)).isZero();
    }

    @Test
    void staleIdDoesNotAdvance() {
        SignIdWatermark watermark = new SignIdWatermark();

        assertThat(watermark.advance(Address.NATIVE, BigInteger.valueOf(10))).isTrue();
        assertThat(watermark.advance(Address.NATIVE, BigInteger.valueOf(5))).isFalse();
        assertThat(watermark.advance(Address.NATIVE, BigInteger.valueOf(10))).isFalse();
        assertThat(watermark.last(Address.NATIVE)).isEqualTo(BigInteger.valueOf(10));
    }

    @Provide
    Arbitrary<BigInteger> identifiers() {
        return Arbitraries.bigIntegers().between(BigInteger.ZERO, BigInteger.ONE.shiftLeft(255));
    }
}
