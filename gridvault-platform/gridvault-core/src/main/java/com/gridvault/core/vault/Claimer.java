package com.gridvault.core.vault;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;

import java.math.BigInteger;

/**
 * Reward claims. Token claims cost a native fee attached to the call.
 */
public class Claimer extends SignerRoleVault {

    public Claimer(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer) {
        super(runtime, "Claimer", authority, admin, admin, signer,
                VaultError.SIGN_ID_ALREADY_USED, VaultError.INVALID_SIGNATURE);
    }

    public void claim(Call call, Address account, Address token, BigInteger value, BigInteger fee,
                      BigInteger deadline, BigInteger signId, VoucherSignature signature) {
        execute(call, () -> {
            requireNonZero(token, "token");
            requirePositive(value, "claim");
            if (call.value().compareTo(fee) < 0) {
                throw new VaultException(VaultError.INSUFFICIENT_FEE,
                        "attached " + call.value() + " below fee " + fee);
            }
            redeem(VoucherMessages.claimerClaim(signId, account, token, value, fee, deadline, address),
                    signature, signId, deadline);
            bookAttachedValue(call);
            ledger.transferOut(token, account, value);
            emitClaimed(account, token, value, deadline, signId);
        });
    }

    public void claimEth(Call call, Address account, BigInteger value, BigInteger deadline,
                         BigInteger signId, VoucherSignature signature) {
        execute(call, () -> {
            requirePositive(value, "claim");
            redeem(VoucherMessages.claimerClaimEth(signId, account, value, deadline, address),
                    signature, signId, deadline);
            bookAttachedValue(call);
            ledger.transferOut(Address.NATIVE, account, value);
            emitClaimed(account, Address.NATIVE, value, deadline, signId);
        });
    }

    private void emitClaimed(Address account, Address token, BigInteger value, BigInteger deadline,
                             BigInteger signId) {
        emit(LedgerEventType.CLAIMED, "account", account, "token", token, "value", value,
                "deadline", deadline, "signId", signId);
    }
}
