package com.gridvault.core.replay;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

/**
 * Set of consumed voucher identifiers. Identifiers are never removed.
 *
 * Identifiers live in a scope: the whole vault by default, or one asset for vaults that
 * run independent id sequences per asset.
 */
public class ReplayGuard extends JournaledState {

    private static final Address VAULT_SCOPE = Address.ZERO;

    private final VaultError replayError;
    private final Set<Key> used = new HashSet<>();

    public ReplayGuard(VaultError replayError) {
        if (replayError == null || replayError.category() != VaultError.Category.REPLAY) {
            throw new IllegalArgumentException("Replay guard needs a replay error, got " + replayError);
        }
        this.replayError = replayError;
    }

    public boolean isUsed(BigInteger id) {
        return isUsed(VAULT_SCOPE, id);
    }

    public boolean isUsed(Address scope, BigInteger id) {
        return used.contains(new Key(scope, id));
    }

    /**
     * Consumes an identifier, rejecting it if it was consumed before.
     */
    public void markUsed(BigInteger id) {
        markUsed(VAULT_SCOPE, id);
    }

    public void markUsed(Address scope, BigInteger id) {
        Key key = new Key(scope, id);
        if (!used.add(key)) {
            throw new VaultException(replayError, "id " + id + " already consumed in scope " + scope);
        }
        journalAdded(used, key);
    }

    public int size() {
        return used.size();
    }

    public VaultError replayError() {
        return replayError;
    }

    private record Key(Address scope, BigInteger id) {
        Key {
            if (scope == null || id == null) {
                throw new IllegalArgumentException("Scope and id cannot be null");
            }
        }
    }
}
