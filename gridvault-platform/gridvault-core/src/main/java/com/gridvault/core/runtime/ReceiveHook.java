package com.gridvault.core.runtime;

import com.gridvault.core.model.Address;

import java.math.BigInteger;

/**
 * Code run by an address when it receives native currency. Throwing fails the transfer.
 */
@FunctionalInterface
public interface ReceiveHook {

    void onReceive(Address from, BigInteger amount);
}
