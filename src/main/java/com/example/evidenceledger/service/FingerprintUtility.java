package com.example.evidenceledger.service;

import com.example.evidenceledger.models.Fingerprint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

/**
 * SHA-256 fingerprints of raw bytes, strings and structured metadata.
 *
 * <p>Structured values are canonicalized before hashing: they are first converted to a plain
 * map/list tree and then written as compact JSON with every object's keys in sorted order, so
 * two values with the same content always produce the same fingerprint regardless of field or
 * insertion order.
 */
@Component
public class FingerprintUtility {

    private static final JsonMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    public Fingerprint digest(byte[] content) {
        if (content == null) {
            throw EvidenceLedgerException.invalidInput("content must not be null");
        }
        return Fingerprint.of(sha256().digest(content));
    }

    public Fingerprint digestString(String value) {
        if (value == null) {
            throw EvidenceLedgerException.invalidInput("value must not be null");
        }
        return digest(value.getBytes(StandardCharsets.UTF_8));
    }

    public Fingerprint digestStructured(Object value) {
        return digestString(canonicalJson(value));
    }

    /**
     * Canonical JSON form used by {@link #digestStructured(Object)}.
     */
    public String canonicalJson(Object value) {
        if (value == null) {
            throw EvidenceLedgerException.invalidInput("metadata must not be null");
        }
        try {
            // POJOs and records become maps first so their keys are sorted like any other map.
            Object tree = CANONICAL_MAPPER.convertValue(value, Object.class);
            return CANONICAL_MAPPER.writeValueAsString(tree);
        } catch (IllegalArgumentException | JsonProcessingException ex) {
            throw EvidenceLedgerException.invalidInput("metadata is not serializable: " + ex.getMessage());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
