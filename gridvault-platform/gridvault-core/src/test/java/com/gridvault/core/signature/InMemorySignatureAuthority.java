package com.gridvault.core.signature;

import com.gridvault.core.model.Address;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fake authority for unit tests: remembers which address "signed" which message.
 * A signature only recovers for the exact message it was issued over.
 */
public class InMemorySignatureAuthority implements SignatureAuthority {

    private final Map<Signed, Address> signers = new HashMap<>();
    private long counter;

    public VoucherSignature sign(Address signer, VoucherMessage message) {
        counter++;
        VoucherSignature signature = new VoucherSignature(27, BigInteger.valueOf(counter), BigInteger.valueOf(counter));
        signers.put(new Signed(message, signature), signer);
        return signature;
    }

    @Override
    public Optional<Address> recoverSigner(VoucherMessage message, VoucherSignature signature) {
        return Optional.ofNullable(signers.get(new Signed(message, signature)));
    }

    private record Signed(VoucherMessage message, VoucherSignature signature) {}
}
