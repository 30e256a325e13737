package com.gridvault.core.vault;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;

import java.math.BigInteger;

/**
 * Pays users out against claim vouchers and takes payments against use vouchers.
 */
public class Bank extends SignerRoleVault {

    public Bank(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer) {
        this(runtime, "Bank", authority, admin, admin, signer, VaultError.ID_USED);
    }

    protected Bank(LedgerRuntime runtime, String name, SignatureAuthority authority, Address admin,
                   Address withdrawer, Address signer, VaultError replayError) {
        super(runtime, name, authority, admin, withdrawer, signer, replayError, VaultError.WRONG_SIGNATURE);
    }

    /**
     * Pays for a use voucher with the native value attached to the call.
     */
    public void useEth(Call call, BigInteger signId, BigInteger param, BigInteger deadline,
                       VoucherSignature signature) {
        processUseEth(call, signId, param, BigInteger.ZERO, deadline, signature);
    }

    /**
     * Pays for a use voucher with tokens the caller approved to the bank.
     */
    public void useToken(Call call, Address token, BigInteger value, BigInteger signId, BigInteger param,
                         BigInteger deadline, VoucherSignature signature) {
        processUseToken(call, token, value, signId, param, BigInteger.ZERO, deadline, signature);
    }

    public void claim(Call call, Address account, Address token, BigInteger value, BigInteger deadline,
                      BigInteger signId, VoucherSignature signature) {
        processClaim(call, account, token, value, BigInteger.ZERO, deadline, signId, signature);
    }

    public void claimEth(Call call, Address account, BigInteger value, BigInteger deadline,
                         BigInteger signId, VoucherSignature signature) {
        processClaimEth(call, account, value, BigInteger.ZERO, deadline, signId, signature);
    }

    protected VoucherMessage useMessage(BigInteger signId, BigInteger value, Address token, Address account,
                                        BigInteger param, BigInteger fee, BigInteger deadline) {
        return VoucherMessages.bankUse(signId, value, token, account, param, deadline, address);
    }

    protected VoucherMessage claimMessage(BigInteger signId, Address account, Address token, BigInteger value,
                                          BigInteger fee, BigInteger deadline) {
        return VoucherMessages.bankClaim(signId, account, token, value, deadline, address);
    }

    /**
     * Charges the voucher fee. Vouchers of this bank carry none.
     */
    protected void collectFee(Address account, BigInteger fee) {
    }

    protected void processUseEth(Call call, BigInteger signId, BigInteger param, BigInteger fee,
                                 BigInteger deadline, VoucherSignature signature) {
        execute(call, () -> {
            BigInteger value = requirePositive(call.value(), "payment");
            redeem(useMessage(signId, value, Address.NATIVE, call.caller(), param, fee, deadline),
                    signature, signId, deadline);
            ledger.credit(Address.NATIVE, value);
            collectFee(call.caller(), fee);
            emitUsed(signId, value, Address.NATIVE, call.caller(), param);
        });
    }

    protected void processUseToken(Call call, Address token, BigInteger value, BigInteger signId,
                                   BigInteger param, BigInteger fee, BigInteger deadline,
                                   VoucherSignature signature) {
        execute(call, () -> {
            requireNonZero(token, "token");
            requirePositive(value, "payment");
            redeem(useMessage(signId, value, token, call.caller(), param, fee, deadline),
                    signature, signId, deadline);
            ledger.pullFrom(token, call.caller(), value);
            collectFee(call.caller(), fee);
            emitUsed(signId, value, token, call.caller(), param);
        });
    }

    protected void processClaim(Call call, Address account, Address token, BigInteger value, BigInteger fee,
                                BigInteger deadline, BigInteger signId, VoucherSignature signature) {
        execute(call, () -> {
            requireNonZero(token, "token");
            requirePositive(value, "claim");
            redeem(claimMessage(signId, account, token, value, fee, deadline), signature, signId, deadline);
            collectFee(account, fee);
            ledger.transferOut(token, account, value);
            emitClaimed(account, token, value, deadline, signId);
        });
    }

    protected void processClaimEth(Call call, Address account, BigInteger value, BigInteger fee,
                                   BigInteger deadline, BigInteger signId, VoucherSignature signature) {
        execute(call, () -> {
            requirePositive(value, "claim");
            redeem(claimMessage(signId, account, Address.NATIVE, value, fee, deadline), signature, signId, deadline);
            collectFee(account, fee);
            ledger.transferOut(Address.NATIVE, account, value);
            emitClaimed(account, Address.NATIVE, value, deadline, signId);
        });
    }

    private void emitUsed(BigInteger signId, BigInteger value, Address token, Address account, BigInteger param) {
        emit(LedgerEventType.USED, "signId", signId, "value", value, "token", token,
                "account", account, "param", param);
    }

    private void emitClaimed(Address account, Address token, BigInteger value, BigInteger deadline,
                             BigInteger signId) {
        emit(LedgerEventType.CLAIMED, "account", account, "token", token, "value", value,
                "deadline", deadline, "signId", signId);
    }
}
