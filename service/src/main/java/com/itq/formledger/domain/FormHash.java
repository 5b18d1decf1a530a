package com.itq.formledger.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 32-byte digest of a submitted form. The registry stores it as-is and never
 * computes it; {@link #sha256(String)} exists for clients and tests.
 */
public final class FormHash {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private FormHash(byte[] bytes) {
        this.bytes = bytes;
    }

    public static FormHash of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Form hash must be exactly " + LENGTH + " bytes");
        }
        return new FormHash(bytes.clone());
    }

    public static FormHash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Form hash must be " + (LENGTH * 2) + " hex characters");
        }
        return new FormHash(HEX.parseHex(hex));
    }

    public static FormHash sha256(String content) {
        return new FormHash(Digests.sha256(content.getBytes(StandardCharsets.UTF_8)));
    }

    public boolean isZero() {
        int acc = 0;
        for (byte b : bytes) {
            acc |= b;
        }
        return acc == 0;
    }

    /** Constant-time comparison over all 32 bytes. */
    public boolean matches(FormHash other) {
        return other != null && MessageDigest.isEqual(bytes, other.bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormHash other)) return false;
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
