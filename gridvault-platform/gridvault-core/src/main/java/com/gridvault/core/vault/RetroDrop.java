package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.replay.ReplayGuard;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.SignerSlot;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import com.gridvault.core.signature.VoucherVerifier;
import com.gridvault.core.vesting.TimeLockEscrow;
import com.gridvault.core.vesting.VestingCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Retroactive token drop. A claim pays a share of the signed maximum that grows with the
 * square root of the lock the claimant accepts; locked payouts go to a time-lock escrow.
 */
public class RetroDrop extends AbstractVault {

    private static final Logger log = LoggerFactory.getLogger(RetroDrop.class);

    public static final long MAX_LOCK_WEEKS = 208;
    public static final long WEEK_SECONDS = 7 * 24 * 60 * 60L;

    private final Address token;
    private final TimeLockEscrow escrow;
    private final SignerSlot signerSlot;
    private final ReplayGuard replay;
    private final VoucherVerifier verifier;

    public RetroDrop(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer,
                     Address token, TimeLockEscrow escrow) {
        super(runtime, "RetroDrop", admin);
        this.token = requireNonZero(token, "token");
        if (escrow == null) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "escrow cannot be null");
        }
        if (!escrow.lockedToken().equals(token)) {
            throw new IllegalArgumentException("Escrow locks " + escrow.lockedToken() + ", not " + token);
        }
        this.escrow = escrow;
        this.signerSlot = track(new SignerSlot(address, runtime.events(), signer));
        this.replay = track(new ReplayGuard(VaultError.SIGN_ID_ALREADY_USED));
        this.verifier = new VoucherVerifier(authority, signerSlot::isSigner, VaultError.INVALID_SIGNATURE);
        roles.grant(Role.WITHDRAW, admin, admin);
    }

    /**
     * Claims the caller's drop. {@code lockWeeks == 0} pays out directly; anything longer locks
     * the payout in the escrow for the caller.
     *
     * @return escrow position id, or zero for a direct payout
     */
    public BigInteger claim(Call call, long lockWeeks, BigInteger signId, BigInteger roachMax, BigInteger deadline,
                            VoucherSignature signature) {
        return invoke(call, () -> {
            if (lockWeeks < 0 || lockWeeks > MAX_LOCK_WEEKS) {
                throw new VaultException(VaultError.INVALID_LOCK_WEEKS,
                        "lock of " + lockWeeks + " weeks outside 0.." + MAX_LOCK_WEEKS);
            }
            VoucherVerifier.requireNotExpired(deadline, now(), VaultError.DEADLINE_EXPIRED);
            verifier.verify(VoucherMessages.retroDropClaim(signId, call.caller(), roachMax, deadline,
                    runtime.chainId(), address), signature);
            replay.markUsed(signId);

            BigInteger amount = calculateAmount(roachMax, lockWeeks);
            BigInteger tokenId = BigInteger.ZERO;
            if (lockWeeks == 0) {
                ledger.transferOut(token, call.caller(), amount);
            } else {
                ledger.debit(token, amount);
                runtime.custody().approve(token, address, escrow.address(), amount);
                tokenId = escrow.createLockFor(address, call.caller(), amount, lockWeeks * WEEK_SECONDS);
            }
            emit(LedgerEventType.CLAIMED, "account", call.caller(), "signId", signId, "roachMax", roachMax,
                    "lockWeeks", BigInteger.valueOf(lockWeeks), "amount", amount, "tokenId", tokenId);
            log.debug("Drop {} claimed by {}: {} for {} weeks", signId, call.caller(), amount, lockWeeks);
            return tokenId;
        });
    }

    public BigInteger calculateAmount(BigInteger roachMax, long lockWeeks) {
        return VestingCurve.payout(roachMax, lockWeeks, MAX_LOCK_WEEKS);
    }

    /**
     * Same as {@link #calculateAmount} but answers zero for an invalid lock instead of failing.
     */
    public BigInteger previewClaim(BigInteger roachMax, long lockWeeks) {
        if (lockWeeks < 0 || lockWeeks > MAX_LOCK_WEEKS) {
            return BigInteger.ZERO;
        }
        return calculateAmount(roachMax, lockWeeks);
    }

    /**
     * Funds the drop with tokens the caller approved to it.
     */
    public void topup(Call call, BigInteger amount) {
        execute(call, () -> {
            requirePositive(amount, "topup");
            ledger.pullFrom(token, call.caller(), amount);
            emit(LedgerEventType.TOPUP, "from", call.caller(), "token", token, "amount", amount);
        });
    }

    public void withdraw(Call call, Address to, BigInteger amount) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            ledger.transferOut(token, to, amount);
            emit(LedgerEventType.WITHDRAWN, "to", to, "amount", amount);
        });
    }

    public void withdrawAll(Call call) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            BigInteger amount = ledger.balanceOf(token);
            ledger.transferOut(token, call.caller(), amount);
            emit(LedgerEventType.WITHDRAWN, "to", call.caller(), "amount", amount);
        });
    }

    public void setSigner(Call call, Address newSigner) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            signerSlot.replace(newSigner);
        });
    }

    public BigInteger getRoachBalance() {
        return ledger.balanceOf(token);
    }

    public boolean isSignIdUsed(BigInteger signId) {
        return replay.isUsed(signId);
    }

    public Address signer() {
        return signerSlot.current();
    }

    public Address token() {
        return token;
    }
}
