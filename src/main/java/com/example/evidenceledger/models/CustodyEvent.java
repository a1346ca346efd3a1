package com.example.evidenceledger.models;

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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One entry of an evidence item's chain-of-custody log. Entries are keyed by
 * {@code (evidence_id, event_index)} and never rewritten once stored.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CustodyEvent {

    @NonNull private Long evidenceId;   // PK
    @NonNull private Long eventIndex;   // SK, 0..n-1
    @NonNull private String handler;
    @NonNull private String action;
    @NonNull private Fingerprint actionFingerprint;
    @NonNull private Long timestamp;
    @NonNull private Fingerprint metadataHash;  // ZERO when no details were supplied

    @DynamoDbPartitionKey
    @DynamoDbAttribute("evidence_id")
    public Long getEvidenceId() { return evidenceId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("event_index")
    public Long getEventIndex() { return eventIndex; }

    @DynamoDbAttribute("handler")
    public String getHandler() { return handler; }

    @DynamoDbAttribute("action")
    public String getAction() { return action; }

    @DynamoDbConvertedBy(FingerprintAttributeConverter.class)
    @DynamoDbAttribute("action_fingerprint")
    public Fingerprint getActionFingerprint() { return actionFingerprint; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbConvertedBy(FingerprintAttributeConverter.class)
    @DynamoDbAttribute("metadata_hash")
    public Fingerprint getMetadataHash() { return metadataHash; }

    public boolean hasMetadata() {
        return !metadataHash.isZero();
    }
}
