package com.itq.formledger.domain;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A 32-byte ledger account address. Callers, admins, the authority and the
 * derived storage locations of records are all addresses.
 *
 * <p>The text form is 64 lowercase hex characters.
 */
public final class Address {

    public static final int LENGTH = 32;

    /** The unset sentinel. Never a valid caller or admin. */
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Address of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + LENGTH + " bytes");
        }
        return new Address(bytes.clone());
    }

    public static Address fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Address must be " + (LENGTH * 2) + " hex characters");
        }
        return new Address(HEX.parseHex(hex));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
