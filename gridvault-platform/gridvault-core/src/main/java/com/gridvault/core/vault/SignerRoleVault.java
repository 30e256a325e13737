package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.replay.ReplayGuard;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherSignature;
import com.gridvault.core.signature.VoucherVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Vault whose vouchers are signed by any holder of {@link Role#SIGNER}, with
 * WITHDRAW-gated manual withdrawals.
 */
public abstract class SignerRoleVault extends AbstractVault {

    private static final Logger log = LoggerFactory.getLogger(SignerRoleVault.class);

    protected final ReplayGuard replay;
    protected final VoucherVerifier verifier;

    protected SignerRoleVault(LedgerRuntime runtime, String name, SignatureAuthority authority,
                              Address admin, Address withdrawer, Address signer,
                              VaultError replayError, VaultError mismatchError) {
        super(runtime, name, admin);
        requireNonZero(withdrawer, "withdrawer");
        requireNonZero(signer, "signer");
        this.replay = track(new ReplayGuard(replayError));
        this.verifier = new VoucherVerifier(authority, a -> roles.hasRole(Role.SIGNER, a), mismatchError);
        roles.grant(Role.WITHDRAW, withdrawer, admin);
        roles.grant(Role.SIGNER, signer, admin);
    }

    /**
     * Deadline, signature, then replay. Must run before any balance moves.
     */
    protected void redeem(VoucherMessage message, VoucherSignature signature, BigInteger signId, BigInteger deadline) {
        VoucherVerifier.requireNotExpired(deadline, now(), VaultError.DEADLINE_EXPIRED);
        verifier.verify(message, signature);
        replay.markUsed(signId);
        log.debug("Redeemed {} voucher {} on {}", message.layout(), signId, address);
    }

    public boolean isSignIdUsed(BigInteger signId) {
        return replay.isUsed(signId);
    }

    public BigInteger getBalance(Address token) {
        return ledger.balanceOf(requireNonZero(token, "token"));
    }

    public BigInteger getEthBalance() {
        return ledger.balanceOf(Address.NATIVE);
    }

    /**
     * Accepts plain native transfers.
     */
    public void receive(Call call) {
        execute(call, () -> bookAttachedValue(call));
    }

    public void withdraw(Call call, Address token, Address to, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            requireNonZero(token, "token");
            payOutToken(token, to, amount);
        });
    }

    public void withdrawAll(Call call, Address token) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            requireNonZero(token, "token");
            payOutToken(token, call.caller(), ledger.balanceOf(token));
        });
    }

    public void withdrawEth(Call call, Address to, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            payOutEth(to, amount);
        });
    }

    public void withdrawAllEth(Call call) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            payOutEth(call.caller(), ledger.balanceOf(Address.NATIVE));
        });
    }

    private void payOutToken(Address token, Address to, BigInteger amount) {
        ledger.transferOut(token, to, amount);
        emit(LedgerEventType.WITHDRAWN, "token", token, "to", to, "amount", amount);
        log.info("Withdrew {} of {} from {} to {}", amount, token, address, to);
    }

    private void payOutEth(Address to, BigInteger amount) {
        ledger.transferOut(Address.NATIVE, to, amount);
        emit(LedgerEventType.WITHDRAWN_ETH, "to", to, "amount", amount);
        log.info("Withdrew {} native from {} to {}", amount, address, to);
    }
}
