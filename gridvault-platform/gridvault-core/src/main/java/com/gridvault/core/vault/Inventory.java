package com.gridvault.core.vault;

import com.gridvault.core.access.Role;
import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.replay.ReplayGuard;
import com.gridvault.core.runtime.Call;
import com.gridvault.core.runtime.JournaledState;
import com.gridvault.core.runtime.LedgerRuntime;
import com.gridvault.core.signature.SignatureAuthority;
import com.gridvault.core.signature.SignerSlot;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import com.gridvault.core.signature.VoucherVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Game item inventory. Claim vouchers mint items and use vouchers burn them; both cost a
 * native fee attached to the call.
 */
public class Inventory extends AbstractVault {

    private static final Logger log = LoggerFactory.getLogger(Inventory.class);

    private final SignerSlot signerSlot;
    private final ReplayGuard replay;
    private final VoucherVerifier verifier;
    private final ItemBook items;

    public Inventory(LedgerRuntime runtime, SignatureAuthority authority, Address admin, Address signer) {
        super(runtime, "Inventory", admin);
        this.signerSlot = track(new SignerSlot(address, runtime.events(), signer));
        this.replay = track(new ReplayGuard(VaultError.SIGN_ALREADY_USED));
        this.verifier = new VoucherVerifier(authority, signerSlot::isSigner, VaultError.WRONG_SIGNATURE);
        this.items = track(new ItemBook());
        roles.grant(Role.WITHDRAW, admin, admin);
    }

    public void claim(Call call, BigInteger signId, BigInteger id, BigInteger amount, BigInteger fee,
                      BigInteger deadline, VoucherSignature signature, byte[] data) {
        execute(call, () -> {
            redeem(VoucherMessages.TAG_CLAIM, call, signId, id, amount, fee, deadline, signature, data);
            items.mint(call.caller(), id, amount);
            emit(LedgerEventType.CLAIMED, "signId", signId, "account", call.caller(), "id", id,
                    "amount", amount, "data", hex(data));
        });
    }

    public void use(Call call, BigInteger signId, BigInteger id, BigInteger amount, BigInteger fee,
                    BigInteger deadline, VoucherSignature signature, byte[] data) {
        execute(call, () -> {
            redeem(VoucherMessages.TAG_USE, call, signId, id, amount, fee, deadline, signature, data);
            items.burn(call.caller(), id, amount);
            emit(LedgerEventType.SIGN_USED, "signId", signId, "account", call.caller(), "id", id,
                    "amount", amount, "data", hex(data));
            emit(LedgerEventType.ITEM_USED, "account", call.caller(), "id", id, "amount", amount,
                    "data", hex(data));
        });
    }

    private void redeem(String tag, Call call, BigInteger signId, BigInteger id, BigInteger amount, BigInteger fee,
                        BigInteger deadline, VoucherSignature signature, byte[] data) {
        requirePositive(amount, "item amount");
        if (call.value().compareTo(fee) < 0) {
            throw new VaultException(VaultError.NOT_ENOUGH_FEE, "attached " + call.value() + " below fee " + fee);
        }
        VoucherVerifier.requireNotExpired(deadline, now(), VaultError.DEADLINE_EXCEEDED);
        verifier.verify(VoucherMessages.inventory(tag, signId, call.caller(), id, amount, fee, deadline, data, address),
                signature);
        replay.markUsed(signId);
        bookAttachedValue(call);
        log.debug("Inventory {} voucher {} redeemed by {}", tag, signId, call.caller());
    }

    public void withdrawEth(Call call) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            BigInteger amount = ledger.balanceOf(Address.NATIVE);
            ledger.transferOut(Address.NATIVE, call.caller(), amount);
            emit(LedgerEventType.WITHDRAWN_ETH, "to", call.caller(), "amount", amount);
        });
    }

    public void withdrawERC20(Call call, Address token) {
        execute(call, () -> {
            roles.require(Role.WITHDRAW, call.caller());
            requireNonZero(token, "token");
            BigInteger amount = ledger.balanceOf(token);
            ledger.transferOut(token, call.caller(), amount);
            emit(LedgerEventType.WITHDRAWN, "token", token, "to", call.caller(), "amount", amount);
        });
    }

    public void setSigner(Call call, Address newSigner) {
        execute(call, () -> {
            roles.require(Role.DEFAULT_ADMIN, call.caller());
            signerSlot.replace(newSigner);
        });
    }

    public BigInteger balanceOf(Address account, BigInteger id) {
        return items.balanceOf(account, id);
    }

    public BigInteger getEthBalance() {
        return ledger.balanceOf(Address.NATIVE);
    }

    public boolean usedSignId(BigInteger signId) {
        return replay.isUsed(signId);
    }

    public Address signer() {
        return signerSlot.current();
    }

    private static String hex(byte[] data) {
        return "0x" + HexFormat.of().formatHex(data);
    }

    /**
     * Item balances per account and item id.
     */
    private static class ItemBook extends JournaledState {

        private final Map<Holding, BigInteger> balances = new HashMap<>();

        BigInteger balanceOf(Address account, BigInteger id) {
            return balances.getOrDefault(new Holding(account, id), BigInteger.ZERO);
        }

        void mint(Address account, BigInteger id, BigInteger amount) {
            Holding holding = new Holding(account, id);
            journalEntry(balances, holding);
            balances.merge(holding, amount, BigInteger::add);
        }

        void burn(Address account, BigInteger id, BigInteger amount) {
            BigInteger held = balanceOf(account, id);
            if (held.compareTo(amount) < 0) {
                throw new VaultException(VaultError.INSUFFICIENT_BALANCE,
                        account + " holds " + held + " of item " + id + ", needs " + amount);
            }
            Holding holding = new Holding(account, id);
            journalEntry(balances, holding);
            balances.put(holding, held.subtract(amount));
        }

        private record Holding(Address account, BigInteger id) {}
    }
}
