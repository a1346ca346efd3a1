package com.example.evidenceledger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Persisted outbound notification. Each evidence item has its own hash chain: the first
 * notification links to {@link #GENESIS_HASH} and every later one to its predecessor's hash.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class LedgerEvent {

    public static final String GENESIS_HASH = "0".repeat(64);

    // Required fields
    @NonNull private Long evidenceId;    // PK
    @NonNull private Long sequence;      // SK, position in this evidence item's stream
    @NonNull private EventType eventType;
    @NonNull private String actor;
    @NonNull private String requestId;
    @NonNull private Long timestamp;     // commit time
    @NonNull private String prevHash;

    // filled in by build()
    private String hash;

    private Map<String, Object> details;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("evidence_id")
    public Long getEvidenceId() { return evidenceId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Long getSequence() { return sequence; }

    @DynamoDbAttribute("event_type")
    public EventType getEventType() { return eventType; }

    @DynamoDbAttribute("actor")
    public String getActor() { return actor; }

    @DynamoDbAttribute("request_id")
    public String getRequestId() { return requestId; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("details")
    public Map<String, Object> getDetails() { return details; }

    public enum EventType {
        EVIDENCE_REGISTERED,
        CUSTODY_EVENT_LOGGED,
        VERIFICATION_PASSED,
        TAMPER_DETECTED,
        VERIFICATION_ATTESTED,
        POLICY_VIOLATION;

        @JsonCreator
        public static EventType fromString(String v) {
            for (EventType t : values()) {
                if (t.name().equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown LedgerEvent.EventType: " + v);
        }
    }

    // hash chain helpers
    public static String computeHash(LedgerEvent e) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
        String detailsJson = JsonStringMapAttributeConverter.toJsonString(
                e.details == null ? Collections.emptyMap() : e.details
        );
        String canon = String.join("|",
                e.evidenceId == null ? "" : String.valueOf(e.evidenceId),
                e.sequence == null ? "" : String.valueOf(e.sequence),
                e.eventType == null ? "" : e.eventType.name(),
                nn(e.actor),
                nn(e.requestId),
                e.timestamp == null ? "" : String.valueOf(e.timestamp),
                detailsJson,
                nn(e.prevHash)
        );
        byte[] digest = md.digest(canon.getBytes(StandardCharsets.UTF_8));
        return Fingerprint.of(digest).toHex().substring(2);
    }

    /**
     * True when the stored hash still matches the event's content.
     */
    public boolean hasValidHash() {
        return hash != null && hash.equals(computeHash(this));
    }

    private static String nn(String s) { return s == null ? "" : s; }

    public static class LedgerEventBuilder {
        public LedgerEvent build() {
            LedgerEvent e = new LedgerEvent(
                    evidenceId, sequence, eventType, actor, requestId, timestamp, prevHash,
                    null, details
            );
            e.hash = computeHash(e);
            return e;
        }
    }
}
