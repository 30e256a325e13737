package com.gridvault.core.signature;

import com.gridvault.core.model.Address;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * One field of a canonical voucher message, typed the way the ABI encoder needs it.
 */
public interface AbiValue {

    BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * ABI type name, e.g. {@code uint256}.
     */
    String abiType();

    record Uint(BigInteger value) implements AbiValue {
        public Uint {
            if (value == null || value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
                throw new IllegalArgumentException("Value out of uint256 range: " + value);
            }
        }

        @Override
        public String abiType() {
            return "uint256";
        }
    }

    record Addr(Address value) implements AbiValue {
        public Addr {
            if (value == null) {
                throw new IllegalArgumentException("Address cannot be null");
            }
        }

        @Override
        public String abiType() {
            return "address";
        }
    }

    record Text(String value) implements AbiValue {
        public Text {
            if (value == null) {
                throw new IllegalArgumentException("Text cannot be null");
            }
        }

        @Override
        public String abiType() {
            return "string";
        }
    }

    record Bytes(byte[] value) implements AbiValue {
        public Bytes {
            if (value == null) {
                throw new IllegalArgumentException("Bytes cannot be null");
            }
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public String abiType() {
            return "bytes";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[0x" + HexFormat.of().formatHex(value) + "]";
        }
    }

    static AbiValue uint(BigInteger value) {
        return new Uint(value);
    }

    static AbiValue uint(long value) {
        return new Uint(BigInteger.valueOf(value));
    }

    static AbiValue address(Address value) {
        return new Addr(value);
    }

    static AbiValue text(String value) {
        return new Text(value);
    }

    static AbiValue bytes(byte[] value) {
        return new Bytes(value);
    }
}
