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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * An independent verifier's confirmation (or denial) of an evidence item's integrity. Keyed by
 * verifier so the store itself rejects a second attestation from the same identity.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Attestation {

    @NonNull private Long evidenceId;        // PK
    @NonNull private String verifier;        // SK
    @NonNull private Long attestationIndex;  // arrival order within the evidence item
    @NonNull private Boolean verified;
    @NonNull private Long timestamp;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("evidence_id")
    public Long getEvidenceId() { return evidenceId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("verifier")
    public String getVerifier() { return verifier; }

    @DynamoDbAttribute("attestation_index")
    public Long getAttestationIndex() { return attestationIndex; }

    @DynamoDbAttribute("verified")
    public Boolean getVerified() { return verified; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }
}
