package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Native-currency deposit vault with automatic reserve rebalancing.
 */
public class Grid extends ReserveVault {

    private static final Logger log = LoggerFactory.getLogger(Grid.class);

    public Grid(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer) {
        super(runtime, "Grid", authority, admin, signer);
    }

    /**
     * Deposits the attached value against an order voucher. The voucher also carries the
     * system balance the reserve band is measured against.
     */
    public void depositEth(Call call, BigInteger orderId, BigInteger deadline, BigInteger systemBalance,
                           VoucherSignature signature) {
        execute(call, () -> {
            BigInteger value = requirePositive(call.value(), "deposit");
            redeemOrder(Address.NATIVE, orderId, deadline,
                    VoucherMessages.gridDepositEth(orderId, call.caller(), value, deadline, systemBalance, address),
                    signature);
            ledger.credit(Address.NATIVE, value);
            deposits.record(call.caller(), Address.NATIVE, value);
            emit(LedgerEventType.ETH_DEPOSITED, "orderId", orderId, "account", call.caller(), "value", value);
            log.debug("Order {} deposited {} from {}", orderId, value, call.caller());
            rebalanceIfAdvanced(Address.NATIVE, orderId, systemBalance);
        });
    }

    public void claimEth(Call call, BigInteger orderId, Address recipient, BigInteger value,
                         VoucherSignature signature) {
        execute(call, () -> {
            requirePositive(value, "claim");
            redeemOrder(Address.NATIVE, orderId, null,
                    VoucherMessages.gridClaimEth(orderId, recipient, value, address), signature);
            deposits.clear(recipient, Address.NATIVE);
            ledger.transferOut(Address.NATIVE, recipient, value);
            emit(LedgerEventType.ETH_CLAIMED, "orderId", orderId, "recipient", recipient, "value", value);
        });
    }

    /**
     * Returns at most the recipient's recorded deposit. The record is cleared even on a partial refund.
     */
    public void refundEth(Call call, Address recipient, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.REFUND, call.caller());
            requireNonZero(recipient, "recipient");
            deposits.consumeForRefund(recipient, Address.NATIVE, amount);
            BigInteger balance = ledger.balanceOf(Address.NATIVE);
            if (amount.compareTo(balance) > 0) {
                throw new VaultException(VaultError.ETH_TRANSFER_FAILED,
                        "refund " + amount + " exceeds balance " + balance);
            }
            ledger.transferOut(Address.NATIVE, recipient, amount);
            emit(LedgerEventType.ETH_REFUNDED, "recipient", recipient, "amount", amount);
            log.info("Refunded {} to {} from {}", amount, recipient, address);
        });
    }

    /**
     * Sends the caller everything above {@code reserved}.
     */
    public void withdrawEth(Call call, BigInteger reserved) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            BigInteger amount = payOutAboveReserve(Address.NATIVE, call.caller(), reserved);
            emit(LedgerEventType.WITHDRAWN_ETH, "to", call.caller(), "amount", amount);
            log.info("Withdrew {} native from {} keeping {}", amount, address, reserved);
        });
    }

    public void setReserveParameters(Call call, BigInteger minCoef, BigInteger maxCoef, BigInteger absoluteMin) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            reserve.setCoefficients(minCoef, maxCoef);
            reserve.setAbsoluteMin(Address.NATIVE, absoluteMin);
            emit(LedgerEventType.RESERVE_PARAMETERS_UPDATED,
                    "minReservesCoef", minCoef, "maxReservesCoef", maxCoef, "absoluteMinReserve", absoluteMin);
        });
    }

    /**
     * Top-up outside any voucher. Zero-value top-ups are accepted and still logged.
     */
    public void receive(Call call) {
        execute(call, () -> {
            bookAttachedValue(call);
            emit(LedgerEventType.TOPUP, "from", call.caller(), "amount", call.value());
        });
    }

    public BigInteger deposits(Address account) {
        return deposits.amountOf(account, Address.NATIVE);
    }

    public boolean isOrderProcessed(BigInteger orderId) {
        return processedOrders.isUsed(Address.NATIVE, orderId);
    }

    public BigInteger lastSignId() {
        return watermark.last(Address.NATIVE);
    }

    public BigInteger absoluteMinReserve() {
        return reserve.absoluteMin(Address.NATIVE);
    }

    public BigInteger getEthBalance() {
        return ledger.balanceOf(Address.NATIVE);
    }
}
