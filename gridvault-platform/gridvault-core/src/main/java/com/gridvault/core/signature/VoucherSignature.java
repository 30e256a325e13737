package com.gridvault.core.signature;

import java.math.BigInteger;

/**
 * ECDSA signature components. A recovery id of 0 or 1 is normalized to 27 or 28.
 */
public record VoucherSignature(int v, BigInteger r, BigInteger s) {

    public VoucherSignature {
        if (v == 0 || v == 1) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new IllegalArgumentException("Recovery id must be 27 or 28, got " + v);
        }
        if (r == null || r.signum() <= 0 || s == null || s.signum() <= 0) {
            throw new IllegalArgumentException("Signature r and s must be positive");
        }
        if (r.bitLength() > 256 || s.bitLength() > 256) {
            throw new IllegalArgumentException("Signature r and s must fit in 32 bytes");
        }
    }
}
