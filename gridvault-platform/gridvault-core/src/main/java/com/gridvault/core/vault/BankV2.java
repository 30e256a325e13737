package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.ledger.SendLimits;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Bank whose vouchers carry a fee, paid in the fee token, plus operator push transfers
 * capped by a per-asset limit.
 */
public class BankV2 extends Bank {

    private static final Logger log = LoggerFactory.getLogger(BankV2.class);

    private final Address feeToken;
    private final SendLimits sendLimits;

    public BankV2(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address withdrawer,
                  Address signer, Address feeToken) {
        super(runtime, "BankV2", authority, admin, withdrawer, signer, VaultError.SIGN_ID_ALREADY_USED);
        this.feeToken = requireNonZero(feeToken, "fee token");
        this.sendLimits = track(new SendLimits());
    }

    public void useEth(Call call, BigInteger signId, BigInteger param, BigInteger fee, BigInteger deadline,
                       VoucherSignature signature) {
        processUseEth(call, signId, param, fee, deadline, signature);
    }

    public void useToken(Call call, Address token, BigInteger value, BigInteger signId, BigInteger param,
                         BigInteger fee, BigInteger deadline, VoucherSignature signature) {
        processUseToken(call, token, value, signId, param, fee, deadline, signature);
    }

    public void claim(Call call, Address account, Address token, BigInteger value, BigInteger fee,
                      BigInteger deadline, BigInteger signId, VoucherSignature signature) {
        processClaim(call, account, token, value, fee, deadline, signId, signature);
    }

    public void claimEth(Call call, Address account, BigInteger value, BigInteger fee, BigInteger deadline,
                         BigInteger signId, VoucherSignature signature) {
        processClaimEth(call, account, value, fee, deadline, signId, signature);
    }

    /**
     * Sets the ceiling of one operator push. The zero address addresses the native currency.
     */
    public void setSendTokenLimit(Call call, Address asset, BigInteger limit) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            sendLimits.setLimit(asset, limit);
            emit(LedgerEventType.SEND_LIMIT_UPDATED, "token", asset, "limit", limit);
            log.info("Send limit of {} on {} set to {}", asset, address, limit);
        });
    }

    public void sendToken(Call call, Address token, Address to, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.OPERATOR, call.caller());
            requireNonZero(token, "token");
            requireNonZero(to, "recipient");
            requirePositive(amount, "amount");
            sendLimits.check(token, amount);
            ledger.transferOut(token, to, amount);
            emit(LedgerEventType.WITHDRAWN, "token", token, "to", to, "amount", amount);
        });
    }

    public void sendEth(Call call, Address to, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.OPERATOR, call.caller());
            requireNonZero(to, "recipient");
            requirePositive(amount, "amount");
            sendLimits.check(Address.NATIVE, amount);
            ledger.transferOut(Address.NATIVE, to, amount);
            emit(LedgerEventType.WITHDRAWN_ETH, "to", to, "amount", amount);
        });
    }

    public BigInteger sendTokenLimit(Address asset) {
        return sendLimits.limitOf(asset);
    }

    public Address feeToken() {
        return feeToken;
    }

    @Override
    protected VoucherMessage useMessage(BigInteger signId, BigInteger value, Address token, Address account,
                                        BigInteger param, BigInteger fee, BigInteger deadline) {
        return VoucherMessages.bankV2Use(signId, value, token, account, param, fee, deadline, address);
    }

    @Override
    protected VoucherMessage claimMessage(BigInteger signId, Address account, Address token, BigInteger value,
                                          BigInteger fee, BigInteger deadline) {
        return VoucherMessages.bankV2Claim(signId, account, token, value, fee, deadline, address);
    }

    @Override
    protected void collectFee(Address account, BigInteger fee) {
        if (fee.signum() > 0) {
            ledger.pullFrom(feeToken, account, fee);
        }
    }
}
