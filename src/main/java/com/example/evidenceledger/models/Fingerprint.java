package com.example.evidenceledger.models;

import com.example.evidenceledger.service.EvidenceLedgerException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Fixed 32-byte digest standing in for the exact content of a piece of evidence, an action name,
 * or an off-ledger metadata document. Rendered at text boundaries as {@code 0x} followed by 64
 * lowercase hex digits. The all-zero value is reserved to mean "absent".
 */
public final class Fingerprint {

    public static final int LENGTH = 32;
    public static final Fingerprint ZERO = new Fingerprint(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private Fingerprint(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Fingerprint of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw EvidenceLedgerException.invalidFingerprint(
                    "Fingerprint must be exactly " + LENGTH + " bytes");
        }
        return new Fingerprint(bytes.clone());
    }

    /**
     * Parses {@code 0x}-prefixed (or bare) hex in either case.
     */
    @JsonCreator
    public static Fingerprint fromHex(String hex) {
        if (hex == null) {
            throw EvidenceLedgerException.invalidFingerprint("Fingerprint hex is missing");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw EvidenceLedgerException.invalidFingerprint(
                    "Fingerprint must have " + (LENGTH * 2) + " hex digits, got " + digits.length());
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int hi = Character.digit(digits.charAt(2 * i), 16);
            int lo = Character.digit(digits.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw EvidenceLedgerException.invalidFingerprint("Fingerprint contains non-hex characters: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return new Fingerprint(out);
    }

    /**
     * A fingerprint made of {@code value} repeated across all 32 bytes; handy for fixtures.
     */
    public static Fingerprint repeating(int value) {
        byte[] out = new byte[LENGTH];
        Arrays.fill(out, (byte) value);
        return new Fingerprint(out);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    public String toHex() {
        char[] out = new char[2 + bytes.length * 2];
        out[0] = '0';
        out[1] = 'x';
        for (int i = 0, j = 2; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fingerprint)) {
            return false;
        }
        return Arrays.equals(bytes, ((Fingerprint) o).bytes);
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
