package com.gridvault.core.event;

/**
 * Types of events emitted by vaults for off-chain indexers.
 */
public enum LedgerEventType {
    // Voucher settlement
    USED("Used"),
    CLAIMED("Claimed"),
    ETH_DEPOSITED("EthDeposited"),
    TOKEN_DEPOSITED("TokenDeposited"),
    ETH_CLAIMED("EthClaimed"),
    TOKEN_CLAIMED("TokenClaimed"),
    SIGN_USED("SignUsed"),
    ITEM_USED("ItemUsed"),

    // Custody movements
    AUTO_WITHDRAWAL("AutoWithdrawal"),
    ETH_REFUNDED("EthRefunded"),
    TOKEN_REFUNDED("TokenRefunded"),
    WITHDRAWN("Withdrawn"),
    WITHDRAWN_ETH("WithdrawnEth"),
    TOKEN_WITHDRAWN("TokenWithdrawn"),
    TOPUP("Topup"),
    BALANCE_SYNCED("BalanceSynced"),
    LOCK_CREATED("LockCreated"),

    // Administration
    ROLE_GRANTED("RoleGranted"),
    ROLE_REVOKED("RoleRevoked"),
    SIGNER_UPDATED("SignerUpdated"),
    WITHDRAW_ADDRESS_UPDATED("WithdrawAddressUpdated"),
    RESERVE_PARAMETERS_UPDATED("ReserveParametersUpdated"),
    RESERVE_COEFFICIENTS_UPDATED("ReserveCoefficientsUpdated"),
    MIN_RESERVES_UPDATED("MinReservesUpdated"),
    SEND_LIMIT_UPDATED("SendLimitUpdated"),

    // Wildcard for subscribers
    ALL("*");

    private final String eventName;

    LedgerEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
