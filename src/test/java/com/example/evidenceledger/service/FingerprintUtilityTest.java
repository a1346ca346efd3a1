package com.example.evidenceledger.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.evidenceledger.models.Fingerprint;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FingerprintUtilityTest {

    private final FingerprintUtility utility = new FingerprintUtility();

    record Handoff(String to, String from, int bags) { }

    @Test
    @DisplayName("digestString matches the published SHA-256 vectors")
    void knownVectors() {
        assertEquals("0xba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                utility.digestString("abc").toHex());
        assertEquals("0xe3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                utility.digestString("").toHex());
        assertEquals(utility.digestString("abc"), utility.digest("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("structured digests ignore key insertion order")
    void keyOrderIndependent() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("location", "Locker 12");
        forward.put("seal", Map.of("number", "S-1", "color", "red"));
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("seal", Map.of("color", "red", "number", "S-1"));
        backward.put("location", "Locker 12");

        assertEquals(utility.digestStructured(forward), utility.digestStructured(backward));
        assertEquals("{\"location\":\"Locker 12\",\"seal\":{\"color\":\"red\",\"number\":\"S-1\"}}",
                utility.canonicalJson(backward));
    }

    @Test
    @DisplayName("records are canonicalized like maps with the same content")
    void recordsSortedLikeMaps() {
        assertEquals(utility.digestStructured(Map.of("bags", 2, "from", "a", "to", "b")),
                utility.digestStructured(new Handoff("b", "a", 2)));
    }

    @Test
    @DisplayName("numbers, dates and lists have a fixed textual form")
    void fixedFormatting() {
        Map<String, Object> value = Map.of(
                "amount", new BigDecimal("1E+3"),
                "at", Instant.parse("2024-10-01T12:00:00Z"),
                "tags", List.of("b", "a"));

        assertEquals("{\"amount\":1000,\"at\":\"2024-10-01T12:00:00Z\",\"tags\":[\"b\",\"a\"]}",
                utility.canonicalJson(value));
        assertNotEquals(utility.digestStructured(Map.of("tags", List.of("a", "b"))),
                utility.digestStructured(Map.of("tags", List.of("b", "a"))));
    }

    @Test
    @DisplayName("null input is rejected")
    void nullRejected() {
        assertEquals(EvidenceLedgerException.Code.INVALID_INPUT,
                assertThrows(EvidenceLedgerException.class, () -> utility.digest(null)).getCode());
        assertEquals(EvidenceLedgerException.Code.INVALID_INPUT,
                assertThrows(EvidenceLedgerException.class, () -> utility.digestString(null)).getCode());
        assertEquals(EvidenceLedgerException.Code.INVALID_INPUT,
                assertThrows(EvidenceLedgerException.class, () -> utility.digestStructured(null)).getCode());
    }

    @Test
    @DisplayName("digests are 32 bytes and never the zero value for real input")
    void digestShape() {
        Fingerprint fp = utility.digest(new byte[0]);
        assertEquals(Fingerprint.LENGTH, fp.toBytes().length);
        assertNotEquals(Fingerprint.ZERO, fp);
    }
}
