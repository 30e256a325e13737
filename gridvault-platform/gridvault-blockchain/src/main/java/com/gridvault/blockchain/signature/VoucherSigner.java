package com.gridvault.blockchain.signature;

import com.gridvault.core.model.Address;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherSignature;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;

import java.math.BigInteger;

/**
 * Signs voucher digests with a single secp256k1 key.
 */
public class VoucherSigner {

    private final Credentials credentials;

    public VoucherSigner(Credentials credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("Credentials cannot be null");
        }
        this.credentials = credentials;
    }

    public static VoucherSigner fromPrivateKey(String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("Private key cannot be null or blank");
        }
        return new VoucherSigner(Credentials.create(privateKey.trim()));
    }

    public VoucherSignature sign(VoucherMessage message) {
        Sign.SignatureData data = Sign.signMessage(
                AbiMessageEncoder.hash(message), credentials.getEcKeyPair(), false);
        return new VoucherSignature(
                data.getV()[0] & 0xff,
                new BigInteger(1, data.getR()),
                new BigInteger(1, data.getS()));
    }

    public Address address() {
        return Address.of(credentials.getAddress());
    }
}
