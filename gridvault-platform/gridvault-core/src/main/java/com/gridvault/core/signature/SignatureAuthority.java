package com.gridvault.core.signature;

import com.gridvault.core.model.Address;

import java.util.Optional;

/**
 * Recovers who signed a voucher message.
 */
public interface SignatureAuthority {

    /**
     * @return the signing address, or empty if the signature cannot be recovered
     */
    Optional<Address> recoverSigner(VoucherMessage message, VoucherSignature signature);
}
