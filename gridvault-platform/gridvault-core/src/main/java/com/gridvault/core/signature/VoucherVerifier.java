package com.gridvault.core.signature;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Checks that a voucher was signed by an authorized signer and is still within its deadline.
 */
public class VoucherVerifier {

    private static final Logger log = LoggerFactory.getLogger(VoucherVerifier.class);

    private final SignatureAuthority authority;
    private final Predicate<Address> authorizedSigner;
    private final VaultError mismatchError;

    /**
     * @param authority        recovers signers from signatures
     * @param authorizedSigner decides whether a recovered address may sign for the vault
     * @param mismatchError    error raised when it may not
     */
    public VoucherVerifier(SignatureAuthority authority, Predicate<Address> authorizedSigner,
                           VaultError mismatchError) {
        if (authority == null || authorizedSigner == null || mismatchError == null) {
            throw new IllegalArgumentException("Authority, signer check and error cannot be null");
        }
        if (mismatchError.category() != VaultError.Category.AUTHORIZATION) {
            throw new IllegalArgumentException("Mismatch error must be an authorization error");
        }
        this.authority = authority;
        this.authorizedSigner = authorizedSigner;
        this.mismatchError = mismatchError;
    }

    /**
     * Recovers the signer and rejects the voucher unless it is authorized.
     *
     * @return the authorized signer
     */
    public Address verify(VoucherMessage message, VoucherSignature signature) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (signature == null) {
            throw new IllegalArgumentException("Signature cannot be null");
        }
        Optional<Address> recovered = authority.recoverSigner(message, signature);
        if (recovered.isEmpty() || !authorizedSigner.test(recovered.get())) {
            log.warn("Rejected {} voucher for {}: recovered {}",
                    message.layout(), message.verifyingContract(), recovered.map(Address::toString).orElse("nothing"));
            throw new VaultException(mismatchError, "voucher not signed by an authorized signer");
        }
        return recovered.get();
    }

    /**
     * Rejects a voucher whose deadline lies before {@code now}. The deadline second itself is valid.
     */
    public static void requireNotExpired(BigInteger deadline, long now, VaultError error) {
        if (deadline == null) {
            throw new IllegalArgumentException("Deadline cannot be null");
        }
        if (BigInteger.valueOf(now).compareTo(deadline) > 0) {
            throw new VaultException(error, "deadline " + deadline + " passed at " + now);
        }
    }
}
