package com.gridvault.blockchain.signature;

import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerClock;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.AbiValue;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import com.gridvault.core.vault.Grid;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * ECDSA signing and recovery over ABI voucher digests.
 */
class Web3jSignatureAuthorityTest {

    static final String SIGNER_KEY = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";
    static final String OTHER_KEY = "0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a";

    private static final long START = 1_700_000_000L;
    private static final Address VAULT = Address.of("0x000000000000000000000000000000000000beef");
    private static final Address ADMIN = Address.of("0x000000000000000000000000000000000000ad31");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000a11ce");

    private final Web3jSignatureAuthority authority = new Web3jSignatureAuthority();

    // ==================== Recovery ====================

    @Test
    void recoversAddressOfSigningKey() {
        VoucherSigner signer = VoucherSigner.fromPrivateKey(SIGNER_KEY);
        VoucherMessage message = VoucherMessages.bankClaim(BigInteger.ONE, ALICE, Address.NATIVE,
                BigInteger.TEN, BigInteger.valueOf(START), VAULT);

        Optional<Address> recovered = authority.recoverSigner(message, signer.sign(message));

        assertThat(signer.address()).isEqualTo(Address.of(Credentials.create(SIGNER_KEY).getAddress()));
        assertThat(recovered).contains(signer.address());
    }

    @Test
    void tamperedMessageRecoversSomeoneElse() {
        VoucherSigner signer = VoucherSigner.fromPrivateKey(SIGNER_KEY);
        VoucherMessage signed = VoucherMessages.bankClaim(BigInteger.ONE, ALICE, Address.NATIVE,
                BigInteger.TEN, BigInteger.valueOf(START), VAULT);
        VoucherMessage tampered = VoucherMessages.bankClaim(BigInteger.ONE, ALICE, Address.NATIVE,
                BigInteger.valueOf(11), BigInteger.valueOf(START), VAULT);

        Optional<Address> recovered = authority.recoverSigner(tampered, signer.sign(signed));

        assertThat(recovered).isNotEqualTo(Optional.of(signer.address()));
    }

    @Test
    void unrecoverableSignatureIsEmpty() {
        VoucherMessage message = VoucherMessages.gridClaimEth(BigInteger.ONE, ALICE, BigInteger.TEN, VAULT);
        VoucherSignature junk = new VoucherSignature(27, AbiValue.MAX_UINT256, BigInteger.ONE);

        assertThat(authority.recoverSigner(message, junk)).isEmpty();
    }

    @Property(tries = 20)
    void signAndRecoverAgreeForAnyAmount(@ForAll @BigRange(min = "1", max = "1000000000000000000000000") BigInteger value,
                                         @ForAll @LongRange(min = 1, max = 1_000_000) long signId) {
        // Property: the recovered address is the signing key's for every voucher
        VoucherSigner signer = VoucherSigner.fromPrivateKey(SIGNER_KEY);
        VoucherMessage message = VoucherMessages.claimerClaimEth(BigInteger.valueOf(signId), ALICE, value,
                BigInteger.valueOf(START), VAULT);

        assertThat(authority.recoverSigner(message, signer.sign(message))).contains(signer.address());
    }

    // ==================== Against a vault ====================

    @Test
    void gridAcceptsDepositSignedByConfiguredKey() {
        VoucherSigner signer = VoucherSigner.fromPrivateKey(SIGNER_KEY);
        LedgerRuntime runtime = new LedgerRuntime(31337, new LedgerClock(START));
        Grid grid = new Grid(runtime, authority, ADMIN, signer.address());
        BigInteger value = BigInteger.valueOf(100);
        BigInteger deadline = BigInteger.valueOf(START + 600);
        runtime.custody().mint(Address.NATIVE, ALICE, value);
        VoucherSignature signature = signer.sign(VoucherMessages.gridDepositEth(
                BigInteger.ONE, ALICE, value, deadline, value, grid.address()));

        grid.depositEth(Call.from(ALICE).withValue(value), BigInteger.ONE, deadline, value, signature);

        assertThat(grid.getEthBalance()).isEqualTo(value);
        assertThat(grid.isOrderProcessed(BigInteger.ONE)).isTrue();
    }

    @Test
    void gridRejectsDepositSignedByOtherKey() {
        VoucherSigner signer = VoucherSigner.fromPrivateKey(SIGNER_KEY);
        VoucherSigner other = VoucherSigner.fromPrivateKey(OTHER_KEY);
        LedgerRuntime runtime = new LedgerRuntime(31337, new LedgerClock(START));
        Grid grid = new Grid(runtime, authority, ADMIN, signer.address());
        BigInteger value = BigInteger.valueOf(100);
        BigInteger deadline = BigInteger.valueOf(START + 600);
        runtime.custody().mint(Address.NATIVE, ALICE, value);
        VoucherSignature forged = other.sign(VoucherMessages.gridDepositEth(
                BigInteger.ONE, ALICE, value, deadline, value, grid.address()));

        assertThatThrownBy(() -> grid.depositEth(Call.from(ALICE).withValue(value), BigInteger.ONE, deadline,
                value, forged))
                .isInstanceOf(VaultException.class)
                .hasMessageContaining("WrongSignature");
        assertThat(runtime.custody().balanceOf(Address.NATIVE, ALICE)).isEqualTo(value);
    }
}
