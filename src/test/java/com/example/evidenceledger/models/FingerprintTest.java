package com.example.evidenceledger.models;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.evidenceledger.service.EvidenceLedgerException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FingerprintTest {

    private static final String AB_HEX = "0x" + "ab".repeat(32);

    @Test
    @DisplayName("toHex renders 0x plus 64 lowercase digits")
    void toHexFormat() {
        String hex = Fingerprint.repeating(0xAB).toHex();

        assertEquals(66, hex.length());
        assertEquals(AB_HEX, hex);
    }

    @Test
    @DisplayName("fromHex accepts 0x, 0X, bare and upper-case input")
    void fromHexVariants() {
        Fingerprint expected = Fingerprint.repeating(0xAB);

        assertEquals(expected, Fingerprint.fromHex(AB_HEX));
        assertEquals(expected, Fingerprint.fromHex("0X" + "AB".repeat(32)));
        assertEquals(expected, Fingerprint.fromHex("ab".repeat(32)));
        assertEquals(expected, Fingerprint.fromHex("0x" + "Ab".repeat(32)));
    }

    @Test
    @DisplayName("fromHex rejects wrong length and non-hex characters")
    void fromHexRejectsMalformed() {
        EvidenceLedgerException shortHex = assertThrows(EvidenceLedgerException.class,
                () -> Fingerprint.fromHex("0x" + "a".repeat(63)));
        assertEquals(EvidenceLedgerException.Code.INVALID_FINGERPRINT, shortHex.getCode());

        EvidenceLedgerException nonHex = assertThrows(EvidenceLedgerException.class,
                () -> Fingerprint.fromHex("0x" + "zz".repeat(32)));
        assertEquals(EvidenceLedgerException.Code.INVALID_FINGERPRINT, nonHex.getCode());

        assertThrows(EvidenceLedgerException.class, () -> Fingerprint.fromHex(null));
    }

    @Test
    @DisplayName("of requires exactly 32 bytes and copies its input")
    void ofCopiesAndChecksLength() {
        assertThrows(EvidenceLedgerException.class, () -> Fingerprint.of(new byte[31]));
        assertThrows(EvidenceLedgerException.class, () -> Fingerprint.of(null));

        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) 7);
        Fingerprint fp = Fingerprint.of(raw);
        raw[0] = 0;

        assertEquals(Fingerprint.repeating(7), fp);
        assertArrayEquals(Fingerprint.repeating(7).toBytes(), fp.toBytes());
    }

    @Test
    @DisplayName("ZERO is the only fingerprint reported as zero")
    void zero() {
        assertTrue(Fingerprint.ZERO.isZero());
        assertTrue(Fingerprint.fromHex("0x" + "0".repeat(64)).isZero());
        assertFalse(Fingerprint.repeating(1).isZero());
        assertEquals(Fingerprint.ZERO, Fingerprint.of(new byte[32]));
    }

    @Test
    @DisplayName("equality and hashCode follow the bytes")
    void equality() {
        assertEquals(Fingerprint.repeating(0x11), Fingerprint.fromHex("11".repeat(32)));
        assertEquals(Fingerprint.repeating(0x11).hashCode(), Fingerprint.fromHex("11".repeat(32)).hashCode());
        assertNotEquals(Fingerprint.repeating(0x11), Fingerprint.repeating(0x12));
    }

    @Test
    @DisplayName("Jackson writes and reads the hex form")
    void jacksonHex() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"" + AB_HEX + "\"", mapper.writeValueAsString(Fingerprint.repeating(0xAB)));
        assertEquals(Fingerprint.repeating(0xAB), mapper.readValue("\"" + AB_HEX + "\"", Fingerprint.class));
    }
}
