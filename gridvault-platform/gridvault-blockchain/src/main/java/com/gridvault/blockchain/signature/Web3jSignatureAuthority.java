package com.gridvault.blockchain.signature;

import com.gridvault.core.model.Address;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Optional;

/**
 * secp256k1 public-key recovery over the ABI digest of a voucher message.
 */
public class Web3jSignatureAuthority implements SignatureAuthority {

    private static final Logger log = LoggerFactory.getLogger(Web3jSignatureAuthority.class);

    @Override
    public Optional<Address> recoverSigner(VoucherMessage message, VoucherSignature signature) {
        byte[] digest = AbiMessageEncoder.hash(message);
        Sign.SignatureData data = new Sign.SignatureData(
                (byte) signature.v(),
                Numeric.toBytesPadded(signature.r(), 32),
                Numeric.toBytesPadded(signature.s(), 32));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, data);
            return Optional.of(Address.of(Numeric.prependHexPrefix(Keys.getAddress(publicKey))));
        } catch (SignatureException | RuntimeException e) {
            log.warn("Unrecoverable signature for {} voucher on {}: {}",
                    message.layout(), message.verifyingContract(), e.getMessage());
            return Optional.empty();
        }
    }
}
