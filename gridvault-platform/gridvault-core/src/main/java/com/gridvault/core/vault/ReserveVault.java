package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.ledger.DepositBook;
import com.gridvault.core.model.Address;
import com.gridvault.core.replay.ReplayGuard;
import com.gridvault.core.replay.SignIdWatermark;
import com.gridvault.core.reserve.ReservePolicy;
import com.gridvault.core.reserve.SweepPlan;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.SignerSlot;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherSignature;
import com.gridvault.core.signature.VoucherVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Deposit vault that rebalances its reserves after every forward-moving deposit.
 *
 * Deposits are bound to an off-chain order id and the system balance reported by the
 * signer. Claims and refunds clear the depositor's record.
 */
public abstract class ReserveVault extends AbstractVault {

    private static final Logger log = LoggerFactory.getLogger(ReserveVault.class);

    protected final SignerSlot signerSlot;
    protected final ReplayGuard processedOrders;
    protected final SignIdWatermark watermark;
    protected final DepositBook deposits;
    protected final ReservePolicy reserve;
    private final VoucherVerifier verifier;

    protected ReserveVault(LedgerRuntime runtime, String name, SignatureAuthority authority,
                           Address admin, Address signer) {
        super(runtime, name, admin);
        this.signerSlot = track(new SignerSlot(address, runtime.events(), signer));
        this.processedOrders = track(new ReplayGuard(VaultError.ORDER_ALREADY_PROCESSED));
        this.watermark = track(new SignIdWatermark());
        this.deposits = track(new DepositBook());
        this.reserve = track(new ReservePolicy(address, runtime.events(), admin));
        this.verifier = new VoucherVerifier(authority, signerSlot::isSigner, VaultError.WRONG_SIGNATURE);
        roles.grant(Role.WITHDRAW, admin, admin);
    }

    /**
     * Deadline (when the voucher has one), signature, then replay within {@code scope}.
     */
    protected void redeemOrder(Address scope, BigInteger orderId, BigInteger deadline,
                               VoucherMessage message, VoucherSignature signature) {
        if (deadline != null) {
            VoucherVerifier.requireNotExpired(deadline, now(), VaultError.DEADLINE_EXPIRED);
        }
        verifier.verify(message, signature);
        processedOrders.markUsed(scope, orderId);
    }

    /**
     * Runs the reserve policy only when {@code orderId} moves the asset's watermark forward.
     */
    protected Optional<SweepPlan> rebalanceIfAdvanced(Address asset, BigInteger orderId, BigInteger systemBalance) {
        if (!watermark.advance(asset, orderId)) {
            log.debug("Order {} on {} is behind watermark {}, reserve check skipped",
                    orderId, address, watermark.last(asset));
            return Optional.empty();
        }
        return Optional.of(reserve.rebalance(asset, systemBalance, ledger));
    }

    /**
     * Pays out everything above {@code reserved} to {@code to}. Nothing moves when the
     * balance equals the reserve.
     *
     * @return amount paid
     */
    protected BigInteger payOutAboveReserve(Address asset, Address to, BigInteger reserved) {
        if (reserved == null || reserved.signum() < 0) {
            throw new IllegalArgumentException("Reserved amount must be non-negative");
        }
        BigInteger balance = ledger.balanceOf(asset);
        if (reserved.compareTo(balance) > 0) {
            throw new VaultException(VaultError.INSUFFICIENT_BALANCE,
                    "reserve " + reserved + " exceeds balance " + balance);
        }
        BigInteger amount = balance.subtract(reserved);
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        ledger.transferOut(asset, to, amount);
        return amount;
    }

    public void setSigner(Call call, Address newSigner) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            signerSlot.replace(newSigner);
        });
    }

    public void setWithdrawAddress(Call call, Address withdrawAddress) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            reserve.setWithdrawAddress(withdrawAddress);
            log.info("Withdraw address of {} set to {}", address, withdrawAddress);
        });
    }

    public Address signer() {
        return signerSlot.current();
    }

    public Address withdrawAddress() {
        return reserve.withdrawAddress();
    }

    public BigInteger minReservesCoef() {
        return reserve.minCoef();
    }

    public BigInteger maxReservesCoef() {
        return reserve.maxCoef();
    }
}
