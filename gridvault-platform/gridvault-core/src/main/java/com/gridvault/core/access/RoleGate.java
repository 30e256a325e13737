package com.gridvault.core.access;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;
import com.gridvault.core.event.EventLog;
import com.gridvault.core.event.LedgerEventType;
import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.JournaledState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Role assignments of one vault.
 *
 * Handlers call {@link #require(Role, Address)} first thing; a missing role rejects
 * the call with {@code AccessControlUnauthorizedAccount}.
 */
public class RoleGate extends JournaledState {

    private static final Logger log = LoggerFactory.getLogger(RoleGate.class);

    private final Address vault;
    private final EventLog events;
    private final Map<Role, Set<Address>> members = new EnumMap<>(Role.class);

    public RoleGate(Address vault, EventLog events) {
        if (vault == null || events == null) {
            throw new IllegalArgumentException("Vault and event log cannot be null");
        }
        this.vault = vault;
        this.events = events;
    }

    public boolean hasRole(Role role, Address account) {
        return members.getOrDefault(role, Set.of()).contains(account);
    }

    /**
     * Rejects the call unless {@code account} holds {@code role}.
     */
    public void require(Role role, Address account) {
        if (!hasRole(role, account)) {
            throw new VaultException(VaultError.ACCESS_CONTROL_UNAUTHORIZED_ACCOUNT,
                    account + " is missing " + role.constantName());
        }
    }

    /**
     * Grants a role. Only holders of the role's admin role may call this.
     */
    public void grantRole(Address caller, Role role, Address account) {
        require(role.adminRole(), caller);
        grant(role, account, caller);
    }

    public void revokeRole(Address caller, Role role, Address account) {
        require(role.adminRole(), caller);
        revoke(role, account, caller);
    }

    /**
     * Drops a role held by the caller. The confirmation must repeat the caller's address.
     */
    public void renounceRole(Address caller, Role role, Address confirmation) {
        if (!caller.equals(confirmation)) {
            throw new VaultException(VaultError.ACCESS_CONTROL_BAD_CONFIRMATION,
                    "confirmation " + confirmation + " does not match caller " + caller);
        }
        revoke(role, caller, caller);
    }

    /**
     * Grants without an authorization check. Used while a vault is being set up.
     */
    public void grant(Role role, Address account, Address sender) {
        if (account == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        Set<Address> holders = members.computeIfAbsent(role, r -> new HashSet<>());
        if (holders.add(account)) {
            journalAdded(holders, account);
            events.emit(LedgerEventType.ROLE_GRANTED, vault,
                    "role", role.constantName(), "account", account, "sender", sender);
            log.info("Granted {} to {} on {}", role.constantName(), account, vault);
        }
    }

    private void revoke(Role role, Address account, Address sender) {
        Set<Address> holders = members.get(role);
        if (holders != null && holders.remove(account)) {
            journalRemoved(holders, account);
            events.emit(LedgerEventType.ROLE_REVOKED, vault,
                    "role", role.constantName(), "account", account, "sender", sender);
            log.info("Revoked {} from {} on {}", role.constantName(), account, vault);
        }
    }
}
