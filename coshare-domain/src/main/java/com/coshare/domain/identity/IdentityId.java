package com.coshare.domain.identity;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Address of an identity in the store: a principal or a shared account.
 *
 * Canonical form is {@code 0x} followed by 64 lowercase hex digits (32 bytes).
 */
public record IdentityId(String value) {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    public IdentityId {
        Objects.requireNonNull(value, "value");
        if (!value.startsWith("0x") || value.length() != 2 + LENGTH * 2) {
            throw new IllegalArgumentException("IdentityId is not canonical: " + value);
        }
        if (!value.equals(value.toLowerCase(Locale.ROOT)) || !isHex(value.substring(2))) {
            throw new IllegalArgumentException("IdentityId is not canonical: " + value);
        }
    }

    /**
     * Parses {@code 0x}-prefixed (or bare) hex, left-padding short forms such as {@code 0xa}.
     */
    public static IdentityId parse(String text) {
        Objects.requireNonNull(text, "text");
        String t = text.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("0x")) t = t.substring(2);
        if (t.isEmpty() || t.length() > LENGTH * 2 || !isHex(t)) {
            throw new IllegalArgumentException("Invalid identity: " + text);
        }
        return new IdentityId("0x" + "0".repeat(LENGTH * 2 - t.length()) + t);
    }

    public static IdentityId of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("IdentityId must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new IdentityId("0x" + HEX.formatHex(bytes));
    }

    /** Fresh copy of the 32 address bytes. */
    public byte[] bytes() {
        return HEX.parseHex(value, 2, value.length());
    }

    /** Compact form without leading zero digits, for logs. */
    public String shortForm() {
        String digits = value.substring(2).replaceFirst("^0+(?=.)", "");
        return "0x" + digits;
    }

    @Override
    public String toString() {
        return value;
    }

    private static boolean isHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
