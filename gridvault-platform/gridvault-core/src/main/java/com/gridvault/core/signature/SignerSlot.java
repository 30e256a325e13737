package com.gridvault.core.signature;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.EventLog;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single replaceable signer key, for vaults that do not use a signer role.
 * Replacing it invalidates every voucher signed by the previous key.
 */
public class SignerSlot extends JournaledState {

    private static final Logger log = LoggerFactory.getLogger(SignerSlot.class);

    private final Address vault;
    private final EventLog events;
    private Address signer;

    public SignerSlot(Address vault, EventLog events, Address initialSigner) {
        if (vault == null || events == null) {
            throw new IllegalArgumentException("Vault and event log cannot be null");
        }
        requireNonZero(initialSigner);
        this.vault = vault;
        this.events = events;
        this.signer = initialSigner;
    }

    public Address current() {
        return signer;
    }

    public boolean isSigner(Address candidate) {
        return signer.equals(candidate);
    }

    /**
     * Swaps the signer key. The caller's authority is checked by the owning vault.
     */
    public void replace(Address newSigner) {
        requireNonZero(newSigner);
        Address previous = signer;
        onUndo(() -> signer = previous);
        signer = newSigner;
        events.emit(LedgerEventType.SIGNER_UPDATED, vault, "previous", previous, "signer", newSigner);
        log.info("Signer of {} changed from {} to {}", vault, previous, newSigner);
    }

    private static void requireNonZero(Address address) {
        if (address == null || address.isZero()) {
            throw new VaultException(VaultError.ZERO_ADDRESS, "signer cannot be the zero address");
        }
    }
}
