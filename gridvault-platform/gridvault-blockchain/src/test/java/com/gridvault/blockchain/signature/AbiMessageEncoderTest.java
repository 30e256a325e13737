package com.gridvault.blockchain.signature;

import com.gridvault.core.model.Address;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherMessages;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class AbiMessageEncoderTest {

    private static final Address VAULT = Address.of("0x000000000000000000000000000000000000beef");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000a11ce");

    @Test
    void staticFieldsEncodeAsConsecutiveWords() {
        VoucherMessage message = VoucherMessages.gridClaimEth(BigInteger.valueOf(7), ALICE, BigInteger.TEN, VAULT);

        byte[] encoded = AbiMessageEncoder.encode(message);

        assertThat(encoded).hasSize(4 * 32);
        assertThat(word(encoded, 0)).isEqualTo(BigInteger.valueOf(7));
        assertThat(word(encoded, 1)).isEqualTo(ALICE.toNumber());
        assertThat(word(encoded, 2)).isEqualTo(BigInteger.TEN);
        assertThat(word(encoded, 3)).isEqualTo(VAULT.toNumber());
    }

    @Test
    void tagIsEncodedAsDynamicString() {
        VoucherMessage message = VoucherMessages.bankClaim(BigInteger.ONE, ALICE, Address.NATIVE, BigInteger.TEN,
                BigInteger.valueOf(1_700_000_000L), VAULT);

        byte[] encoded = AbiMessageEncoder.encode(message);

        // seven head words, then length and one padded word for "claim"
        assertThat(encoded).hasSize(9 * 32);
        assertThat(word(encoded, 0)).isEqualTo(BigInteger.valueOf(7 * 32));
        assertThat(word(encoded, 7)).isEqualTo(BigInteger.valueOf(5));
    }

    @Test
    void hashIsKeccakOfEncoding() {
        VoucherMessage message = VoucherMessages.gridClaimEth(BigInteger.ONE, ALICE, BigInteger.TEN, VAULT);

        assertThat(AbiMessageEncoder.hash(message))
                .hasSize(32)
                .isEqualTo(Hash.sha3(AbiMessageEncoder.encode(message)));
    }

    @Test
    void differentVaultsHashDifferently() {
        Address otherVault = Address.of("0x000000000000000000000000000000000000cafe");

        assertThat(AbiMessageEncoder.hash(VoucherMessages.gridClaimEth(BigInteger.ONE, ALICE, BigInteger.TEN, VAULT)))
                .isNotEqualTo(AbiMessageEncoder.hash(
                        VoucherMessages.gridClaimEth(BigInteger.ONE, ALICE, BigInteger.TEN, otherVault)));
    }

    private static BigInteger word(byte[] encoded, int index) {
        return new BigInteger(1, Arrays.copyOfRange(encoded, index * 32, (index + 1) * 32));
    }
}
