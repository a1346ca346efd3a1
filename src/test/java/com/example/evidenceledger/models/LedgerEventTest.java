package com.example.evidenceledger.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LedgerEventTest {

    private static LedgerEvent.LedgerEventBuilder base() {
        return LedgerEvent.builder()
                .evidenceId(1L)
                .sequence(0L)
                .eventType(LedgerEvent.EventType.EVIDENCE_REGISTERED)
                .actor("officer.alvarez")
                .requestId("req-1")
                .timestamp(1_000L)
                .prevHash(LedgerEvent.GENESIS_HASH);
    }

    @Test
    @DisplayName("build computes the hash")
    void buildComputesHash() {
        LedgerEvent e = base().details(Map.of("case_id", "CASE-1")).build();

        assertNotNull(e.getHash());
        assertEquals(64, e.getHash().length());
        assertEquals(LedgerEvent.computeHash(e), e.getHash());
        assertTrue(e.hasValidHash());
    }

    @Test
    @DisplayName("changing any field after build invalidates the hash")
    void tamperingInvalidatesHash() {
        LedgerEvent e = base().build();

        e.setActor("someone.else");

        assertFalse(e.hasValidHash());
    }

    @Test
    @DisplayName("genesis hash is 64 zeros and part of the digest")
    void genesisHash() {
        assertEquals("0".repeat(64), LedgerEvent.GENESIS_HASH);

        LedgerEvent genesis = base().build();
        LedgerEvent linked = base().prevHash(genesis.getHash()).build();

        assertNotEquals(genesis.getHash(), linked.getHash());
    }

    @Test
    @DisplayName("details insertion order does not change the hash")
    void detailsOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("action", "SEALED");
        first.put("event_index", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("event_index", 1);
        second.put("action", "SEALED");

        assertEquals(base().details(first).build().getHash(), base().details(second).build().getHash());
    }

    @Test
    @DisplayName("builder rejects missing required fields")
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> base().actor(null).build());
    }

    @Test
    @DisplayName("unknown event type names are rejected")
    void unknownEventType() {
        assertEquals(LedgerEvent.EventType.TAMPER_DETECTED, LedgerEvent.EventType.fromString("TAMPER_DETECTED"));
        assertThrows(IllegalArgumentException.class, () -> LedgerEvent.EventType.fromString("PURGED"));
    }
}
