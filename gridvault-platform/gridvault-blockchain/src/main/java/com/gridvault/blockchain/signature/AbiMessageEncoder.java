package com.gridvault.blockchain.signature;

import com.gridvault.core.signature.AbiValue;
import com.gridvault.core.signature.VoucherMessage;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the digest a voucher signer signs: {@code keccak256(abi.encode(fields...))},
 * without any EIP-191 prefix.
 */
public final class AbiMessageEncoder {

    private AbiMessageEncoder() {}

    /**
     * Standard ABI encoding of the message fields as one tuple.
     */
    @SuppressWarnings("rawtypes")
    public static byte[] encode(VoucherMessage message) {
        List<Type> parameters = new ArrayList<>(message.fields().size());
        for (AbiValue field : message.fields()) {
            parameters.add(toAbiType(field));
        }
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(parameters));
    }

    public static byte[] hash(VoucherMessage message) {
        return Hash.sha3(encode(message));
    }

    @SuppressWarnings("rawtypes")
    static Type toAbiType(AbiValue field) {
        if (field instanceof AbiValue.Uint uint) {
            return new Uint256(uint.value());
        }
        if (field instanceof AbiValue.Addr addr) {
            return new org.web3j.abi.datatypes.Address(addr.value().value());
        }
        if (field instanceof AbiValue.Text text) {
            return new Utf8String(text.value());
        }
        if (field instanceof AbiValue.Bytes bytes) {
            return new DynamicBytes(bytes.value());
        }
        throw new IllegalArgumentException("Unsupported ABI field: " + field);
    }
}
