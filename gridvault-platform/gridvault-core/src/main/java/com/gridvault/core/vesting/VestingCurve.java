package com.gridvault.core.vesting;

import com.gridvault.core.error.VaultError;
import com.gridvault.core.error.VaultException;

import java.math.BigInteger;

/**
 * Square-root time weighting of a payout: {@code principal * sqrt((lockWeeks + 1) / (maxWeeks + 1))}.
 * Integer arithmetic only, at 18 decimals of precision.
 */
public final class VestingCurve {

    public static final BigInteger SCALE = BigInteger.TEN.pow(18);
    private static final BigInteger SCALE_SQUARED = SCALE.multiply(SCALE);

    private VestingCurve() {}

    /**
     * Floor of the square root by Newton's method, starting from {@code v} and stopping
     * once an iteration no longer decreases.
     */
    public static BigInteger sqrt(BigInteger v) {
        if (v == null || v.signum() < 0) {
            throw new IllegalArgumentException("Square root needs a non-negative value");
        }
        if (v.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger x = v;
        while (true) {
            BigInteger next = x.add(v.divide(x)).shiftRight(1);
            if (next.compareTo(x) >= 0) {
                return x;
            }
            x = next;
        }
    }

    /**
     * @throws VaultException {@code InvalidLockWeeks} if {@code lockWeeks > maxWeeks}
     */
    public static BigInteger payout(BigInteger principal, long lockWeeks, long maxWeeks) {
        if (principal == null || principal.signum() < 0) {
            throw new IllegalArgumentException("Principal must be non-negative");
        }
        if (lockWeeks < 0 || maxWeeks < 0) {
            throw new IllegalArgumentException("Weeks cannot be negative");
        }
        if (lockWeeks > maxWeeks) {
            throw new VaultException(VaultError.INVALID_LOCK_WEEKS,
                    "lock of " + lockWeeks + " weeks exceeds maximum " + maxWeeks);
        }
        BigInteger ratio = BigInteger.valueOf(lockWeeks + 1).multiply(SCALE_SQUARED)
                .divide(BigInteger.valueOf(maxWeeks + 1));
        return principal.multiply(sqrt(ratio)).divide(SCALE);
    }
}
