package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
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
 * Token deposit vault with automatic reserve rebalancing.
 * Each token runs its own order-id sequence, watermark and absolute reserve minimum.
 */
public class GridleToken extends ReserveVault {

    private static final Logger log = LoggerFactory.getLogger(GridleToken.class);

    public GridleToken(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer) {
        super(runtime, "GridleToken", authority, admin, signer);
        roles.grant(Role.REFUND, admin, admin);
    }

    /**
     * Pulls approved tokens from the caller against an order voucher, then rebalances if the
     * order id moves the token's watermark forward.
     */
    public void depositToken(Call call, BigInteger orderId, Address token, BigInteger amount, BigInteger deadline,
                             BigInteger systemBalance, VoucherSignature signature) {
        execute(call, () -> {
            requireNonZero(token, "token");
            requirePositive(amount, "deposit");
            redeemOrder(token, orderId, deadline,
                    VoucherMessages.gridDepositToken(orderId, call.caller(), token, amount, deadline,
                            systemBalance, address),
                    signature);
            ledger.pullFrom(token, call.caller(), amount);
            deposits.record(call.caller(), token, amount);
            emit(LedgerEventType.TOKEN_DEPOSITED,
                    "orderId", orderId, "account", call.caller(), "token", token, "amount", amount);
            log.debug("Order {} deposited {} of {} from {}", orderId, amount, token, call.caller());
            rebalanceIfAdvanced(token, orderId, systemBalance);
        });
    }

    public void claimToken(Call call, BigInteger orderId, Address recipient, Address token, BigInteger amount,
                           VoucherSignature signature) {
        execute(call, () -> {
            requireNonZero(token, "token");
            requirePositive(amount, "claim");
            redeemOrder(token, orderId, null,
                    VoucherMessages.gridClaimToken(orderId, recipient, token, amount, address), signature);
            deposits.clear(recipient, token);
            ledger.transferOut(token, recipient, amount);
            emit(LedgerEventType.TOKEN_CLAIMED,
                    "orderId", orderId, "recipient", recipient, "token", token, "amount", amount);
        });
    }

    public void refundToken(Call call, Address recipient, Address token, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.REFUND, call.caller());
            requireNonZero(recipient, "recipient");
            requireNonZero(token, "token");
            deposits.consumeForRefund(recipient, token, amount);
            ledger.transferOut(token, recipient, amount);
            emit(LedgerEventType.TOKEN_REFUNDED, "recipient", recipient, "token", token, "amount", amount);
            log.info("Refunded {} of {} to {} from {}", amount, token, recipient, address);
        });
    }

    /**
     * Sends the caller every unit of {@code token} above {@code reserved}.
     */
    public void withdrawERC20(Call call, Address token, BigInteger reserved) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            requireNonZero(token, "token");
            BigInteger amount = payOutAboveReserve(token, call.caller(), reserved);
            emit(LedgerEventType.TOKEN_WITHDRAWN,
                    "to", call.caller(), "token", token, "amount", amount, "reserved", reserved);
        });
    }

    public void setReserveCoefficients(Call call, BigInteger minCoef, BigInteger maxCoef) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            reserve.setCoefficients(minCoef, maxCoef);
            emit(LedgerEventType.RESERVE_COEFFICIENTS_UPDATED,
                    "minReservesCoef", minCoef, "maxReservesCoef", maxCoef);
        });
    }

    public void setMinReserves(Call call, Address token, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            reserve.setAbsoluteMin(token, amount);
            emit(LedgerEventType.MIN_RESERVES_UPDATED, "token", token, "amount", amount);
        });
    }

    /**
     * Adds approved tokens to the reserves without a voucher.
     */
    public void topup(Call call, Address token, BigInteger amount) {
        execute(call, () -> {
            requirePositive(amount, "topup");
            ledger.pullFrom(token, call.caller(), amount);
            emit(LedgerEventType.TOPUP, "from", call.caller(), "token", token, "amount", amount);
        });
    }

    public BigInteger deposits(Address account, Address token) {
        return deposits.amountOf(account, token);
    }

    public boolean isOrderProcessed(Address token, BigInteger orderId) {
        return processedOrders.isUsed(token, orderId);
    }

    public BigInteger lastSignId(Address token) {
        return watermark.last(token);
    }

    public BigInteger minReserves(Address token) {
        return reserve.absoluteMin(token);
    }

    public BigInteger getBalance(Address token) {
        return ledger.balanceOf(token);
    }
}
