package com.gridvault.core.signature;

import com.gridvault.core.model.Address;

import java.util.List;

/**
 * The exact ordered tuple an off-chain signer signed for one voucher.
 *
 * @param layout            name of the encoding layout, e.g. {@code grid.depositEth}
 * @param verifyingContract vault the voucher is bound to; always one of the fields
 * @param fields            ABI fields in signing order
 */
public record VoucherMessage(String layout, Address verifyingContract, List<AbiValue> fields) {

    public VoucherMessage {
        if (layout == null || layout.isBlank()) {
            throw new IllegalArgumentException("Layout cannot be null or blank");
        }
        if (verifyingContract == null || verifyingContract.isZero()) {
            throw new IllegalArgumentException("Verifying contract cannot be null or zero");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Fields cannot be null or empty");
        }
        fields = List.copyOf(fields);
        if (!fields.contains(new AbiValue.Addr(verifyingContract))) {
            throw new IllegalArgumentException("Message must bind the verifying contract " + verifyingContract);
        }
    }
}
