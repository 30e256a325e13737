package com.gridvault.core.access;

/**
 * Roles a vault grants. Every role is administered by {@link #DEFAULT_ADMIN}.
 */
public enum Role {
    DEFAULT_ADMIN("DEFAULT_ADMIN_ROLE"),
    SIGNER("SIGNER_ROLE"),
    WITHDRAW("WITHDRAW_ROLE"),
    OPERATOR("OPERATOR_ROLE"),
    REFUND("REFUND_ROLE");

    private final String constantName;

    Role(String constantName) {
        this.constantName = constantName;
    }

    /**
     * Name of the role constant as exposed to clients, e.g. {@code SIGNER_ROLE}.
     */
    public String constantName() {
        return constantName;
    }

    public Role adminRole() {
        return DEFAULT_ADMIN;
    }
}
