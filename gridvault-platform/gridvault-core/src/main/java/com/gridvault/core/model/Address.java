package com.gridvault.core.model;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A 20-byte account or contract address in lowercase 0x-prefixed hex.
 * The zero address doubles as the asset id of the native currency.
 */
public record Address(String value) implements Comparable<Address> {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    /**
     * Asset id reserved for the native currency.
     */
    public static final Address NATIVE = ZERO;

    public Address {
        if (value == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!HEX_ADDRESS.matcher(value).matches()) {
            throw new IllegalArgumentException("Malformed address: " + value);
        }
    }

    public static Address of(String hex) {
        return new Address(hex);
    }

    /**
     * Builds an address from the low 160 bits of a number.
     */
    public static Address fromNumber(BigInteger number) {
        if (number == null || number.signum() < 0 || number.bitLength() > 160) {
            throw new IllegalArgumentException("Address number out of range: " + number);
        }
        return new Address(String.format("0x%040x", number));
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    public BigInteger toNumber() {
        return new BigInteger(value.substring(2), 16);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
