package com.example.evidenceledger.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
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

/**
 * Anchor record for a piece of evidence. Identity fields are written once at registration;
 * only {@code status} and {@code custodyEventCount} change afterwards, and the count only grows.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Evidence {

    // Fixed at registration
    @NonNull
    private Long evidenceId;

    @NonNull
    private Fingerprint fingerprint;

    @NonNull
    private String caseId;

    @NonNull
    private String collector;

    @NonNull
    private Long registeredAt;

    // Mutable fields
    @NonNull
    private Status status;

    @NonNull
    private Long custodyEventCount;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("evidence_id")
    public Long getEvidenceId() { return evidenceId; }

    @DynamoDbConvertedBy(FingerprintAttributeConverter.class)
    @DynamoDbAttribute("fingerprint")
    public Fingerprint getFingerprint() { return fingerprint; }

    @DynamoDbAttribute("case_id")
    public String getCaseId() { return caseId; }

    @DynamoDbAttribute("collector")
    public String getCollector() { return collector; }

    @DynamoDbAttribute("registered_at")
    public Long getRegisteredAt() { return registeredAt; }

    @DynamoDbAttribute("status")
    public Status getStatus() { return status; }

    @DynamoDbAttribute("custody_event_count")
    public Long getCustodyEventCount() { return custodyEventCount; }

    // ----- Domain helpers -----

    public boolean matches(Fingerprint submitted) {
        return fingerprint.equals(submitted);
    }

    public Evidence withCustodyEventAppended(Status newStatus) {
        return toBuilder()
                .status(newStatus)
                .custodyEventCount(custodyEventCount + 1)
                .build();
    }

    public enum Status {
        UNSET,
        REGISTERED,
        FLAGGED,
        VERIFIED;

        @JsonCreator
        public static Status fromString(String v) {
            for (Status s : values()) {
                if (s.name().equals(v)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown Evidence.Status: " + v);
        }
    }
}
