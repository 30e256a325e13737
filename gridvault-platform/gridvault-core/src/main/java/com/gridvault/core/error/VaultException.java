package com.gridvault.core.error;

/**
 * A rejected vault operation. The runtime discards every state change made by the call.
 */
public class VaultException extends RuntimeException {

    private final VaultError error;

    public VaultException(VaultError error, String detail) {
        super(error.code() + ": " + detail);
        this.error = error;
    }

    public VaultException(VaultError error, String detail, Throwable cause) {
        super(error.code() + ": " + detail, cause);
        this.error = error;
    }

    public VaultError error() {
        return error;
    }

    public VaultError.Category category() {
        return error.category();
    }
}
