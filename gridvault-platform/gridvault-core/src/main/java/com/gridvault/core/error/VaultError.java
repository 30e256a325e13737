package com.gridvault.core.error;

/**
 * Every way a vault operation can be rejected.
 * The code is the name off-chain clients match on.
 */
public enum VaultError {

    ZERO_ADDRESS("ZeroAddress", Category.INPUT_VALIDATION),
    ZERO_VALUE("ZeroValue", Category.INPUT_VALIDATION),
    // Reserved for batch entry points; no current operation raises it
    ARRAYS_LENGTH_MISMATCH("ArraysLengthMismatch", Category.INPUT_VALIDATION),

    WRONG_SIGNATURE("WrongSignature", Category.AUTHORIZATION),
    INVALID_SIGNATURE("InvalidSignature", Category.AUTHORIZATION),
    ACCESS_CONTROL_UNAUTHORIZED_ACCOUNT("AccessControlUnauthorizedAccount", Category.AUTHORIZATION),
    ACCESS_CONTROL_BAD_CONFIRMATION("AccessControlBadConfirmation", Category.AUTHORIZATION),

    DEADLINE_EXPIRED("DeadlineExpired", Category.TEMPORAL),
    DEADLINE_EXCEEDED("DeadlineExceeded", Category.TEMPORAL),

    ORDER_ALREADY_PROCESSED("OrderAlreadyProcessed", Category.REPLAY),
    SIGN_ID_ALREADY_USED("SignIdAlreadyUsed", Category.REPLAY),
    ID_USED("IdUsed", Category.REPLAY),
    SIGN_ALREADY_USED("SignAlreadyUsed", Category.REPLAY),

    INSUFFICIENT_BALANCE("InsufficientBalance", Category.CAPACITY),
    INSUFFICIENT_FEE("InsufficientFee", Category.CAPACITY),
    NOT_ENOUGH_FEE("NotEnoughFee", Category.CAPACITY),
    EXCEEDS_TOKEN_LIMIT("ExceedsTokenLimit", Category.CAPACITY),
    // Reserved for aggregate send caps; per-asset caps raise EXCEEDS_TOKEN_LIMIT
    EXCEEDS_LIMIT("ExceedsLimit", Category.CAPACITY),

    INVALID_REFUND_AMOUNT("InvalidRefundAmount", Category.POLICY),
    INVALID_COEFFICIENT_ORDER("InvalidCoefficientOrder", Category.POLICY),
    MIN_COEFFICIENT_TOO_LOW("MinCoefficientTooLow", Category.POLICY),
    MAX_COEFFICIENT_TOO_LOW("MaxCoefficientTooLow", Category.POLICY),
    INVALID_LOCK_WEEKS("InvalidLockWeeks", Category.POLICY),

    ETH_TRANSFER_FAILED("EthTransferFailed", Category.TRANSFER),
    TRANSFER_FAILED("TransferFailed", Category.TRANSFER);

    private final String code;
    private final Category category;

    VaultError(String code, Category category) {
        this.code = code;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public Category category() {
        return category;
    }

    /**
     * Error families. None of them is fatal to the vault; each aborts only its own call.
     */
    public enum Category {
        INPUT_VALIDATION,
        AUTHORIZATION,
        TEMPORAL,
        REPLAY,
        CAPACITY,
        POLICY,
        TRANSFER
    }
}
