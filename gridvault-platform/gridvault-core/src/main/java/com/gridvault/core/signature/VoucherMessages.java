package com.gridvault.core.signature;

import com.gridvault.core.model.Address;

import java.math.BigInteger;
import java.util.List;

import static com.gridvault.core.signature.AbiValue.address;
import static com.gridvault.core.signature.AbiValue.bytes;
import static com.gridvault.core.signature.AbiValue.text;
import static com.gridvault.core.signature.AbiValue.uint;

/**
 * Canonical message layouts of every voucher kind.
 *
 * Field order is fixed by the signers already issuing vouchers; changing it breaks
 * verification of every outstanding voucher.
 */
public final class VoucherMessages {

    public static final String TAG_USE = "use";
    public static final String TAG_CLAIM = "claim";

    private VoucherMessages() {}

    /** {@code "use", signId, value, token, account, param, deadline, contract} */
    public static VoucherMessage bankUse(BigInteger signId, BigInteger value, Address token, Address account,
                                         BigInteger param, BigInteger deadline, Address contract) {
        return new VoucherMessage("bank.use", contract, List.of(
                text(TAG_USE), uint(signId), uint(value), address(token), address(account),
                uint(param), uint(deadline), address(contract)));
    }

    /** {@code "claim", signId, account, token, value, deadline, contract} */
    public static VoucherMessage bankClaim(BigInteger signId, Address account, Address token, BigInteger value,
                                           BigInteger deadline, Address contract) {
        return new VoucherMessage("bank.claim", contract, List.of(
                text(TAG_CLAIM), uint(signId), address(account), address(token), uint(value),
                uint(deadline), address(contract)));
    }

    /** {@code "use", signId, value, token, account, param, fee, deadline, contract} */
    public static VoucherMessage bankV2Use(BigInteger signId, BigInteger value, Address token, Address account,
                                           BigInteger param, BigInteger fee, BigInteger deadline, Address contract) {
        return new VoucherMessage("bankV2.use", contract, List.of(
                text(TAG_USE), uint(signId), uint(value), address(token), address(account),
                uint(param), uint(fee), uint(deadline), address(contract)));
    }

    /** {@code "claim", signId, account, token, value, fee, deadline, contract} */
    public static VoucherMessage bankV2Claim(BigInteger signId, Address account, Address token, BigInteger value,
                                             BigInteger fee, BigInteger deadline, Address contract) {
        return new VoucherMessage("bankV2.claim", contract, List.of(
                text(TAG_CLAIM), uint(signId), address(account), address(token), uint(value),
                uint(fee), uint(deadline), address(contract)));
    }

    /** {@code signId, account, token, value, fee, deadline, contract} */
    public static VoucherMessage claimerClaim(BigInteger signId, Address account, Address token, BigInteger value,
                                              BigInteger fee, BigInteger deadline, Address contract) {
        return new VoucherMessage("claimer.claim", contract, List.of(
                uint(signId), address(account), address(token), uint(value), uint(fee),
                uint(deadline), address(contract)));
    }

    /** {@code signId, account, 0x0, value, deadline, contract} */
    public static VoucherMessage claimerClaimEth(BigInteger signId, Address account, BigInteger value,
                                                 BigInteger deadline, Address contract) {
        return new VoucherMessage("claimer.claimEth", contract, List.of(
                uint(signId), address(account), address(Address.NATIVE), uint(value),
                uint(deadline), address(contract)));
    }

    /** {@code orderId, account, value, deadline, systemBalance, contract} */
    public static VoucherMessage gridDepositEth(BigInteger orderId, Address account, BigInteger value,
                                                BigInteger deadline, BigInteger systemBalance, Address contract) {
        return new VoucherMessage("grid.depositEth", contract, List.of(
                uint(orderId), address(account), uint(value), uint(deadline), uint(systemBalance),
                address(contract)));
    }

    /** {@code orderId, recipient, value, contract} */
    public static VoucherMessage gridClaimEth(BigInteger orderId, Address recipient, BigInteger value,
                                              Address contract) {
        return new VoucherMessage("grid.claimEth", contract, List.of(
                uint(orderId), address(recipient), uint(value), address(contract)));
    }

    /** {@code orderId, account, token, value, deadline, systemBalance, contract} */
    public static VoucherMessage gridDepositToken(BigInteger orderId, Address account, Address token,
                                                  BigInteger value, BigInteger deadline, BigInteger systemBalance,
                                                  Address contract) {
        return new VoucherMessage("grid.depositToken", contract, List.of(
                uint(orderId), address(account), address(token), uint(value), uint(deadline),
                uint(systemBalance), address(contract)));
    }

    /** {@code orderId, recipient, token, value, contract} */
    public static VoucherMessage gridClaimToken(BigInteger orderId, Address recipient, Address token,
                                                BigInteger value, Address contract) {
        return new VoucherMessage("grid.claimToken", contract, List.of(
                uint(orderId), address(recipient), address(token), uint(value), address(contract)));
    }

    /** {@code signId, account, roachMax, deadline, chainId, contract} */
    public static VoucherMessage retroDropClaim(BigInteger signId, Address account, BigInteger roachMax,
                                                BigInteger deadline, long chainId, Address contract) {
        return new VoucherMessage("retroDrop.claim", contract, List.of(
                uint(signId), address(account), uint(roachMax), uint(deadline), uint(chainId),
                address(contract)));
    }

    /** {@code signId, account, id, amount, fee, deadline, data, contract, tag} */
    public static VoucherMessage inventory(String tag, BigInteger signId, Address account, BigInteger id,
                                           BigInteger amount, BigInteger fee, BigInteger deadline, byte[] data,
                                           Address contract) {
        if (!TAG_CLAIM.equals(tag) && !TAG_USE.equals(tag)) {
            throw new IllegalArgumentException("Inventory tag must be claim or use, got " + tag);
        }
        return new VoucherMessage("inventory." + tag, contract, List.of(
                uint(signId), address(account), uint(id), uint(amount), uint(fee), uint(deadline),
                bytes(data), address(contract), text(tag)));
    }
}
