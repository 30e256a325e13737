package com.gridvault.core.reserve;

import com.gridvault.core.model.Address;

import java.math.BigInteger;

/**
 * Reserve band of one asset. Coefficients are basis points of the reported system balance.
 */
public record ReserveParameters(
        BigInteger minCoef,
        BigInteger maxCoef,
        BigInteger absoluteMin,
        Address withdrawAddress
) {
}
