package com.docstore.core;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque 12-byte identifier assigned by the server on insert.
 * Rendered as 24 lowercase hex characters.
 */
public final class Identifier implements Comparable<Identifier> {
    public static final int LENGTH = 12;
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Identifier(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Identifier of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("identifier must be exactly " + LENGTH + " bytes");
        }
        return new Identifier(bytes.clone());
    }

    public static Identifier fromHex(String hex) {
        if (!isValid(hex)) {
            throw new IllegalArgumentException("invalid identifier: " + hex);
        }
        return new Identifier(HEX.parseHex(hex));
    }

    public static boolean isValid(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            return false;
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public int compareTo(Identifier other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier && Arrays.equals(bytes, ((Identifier) o).bytes);
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
