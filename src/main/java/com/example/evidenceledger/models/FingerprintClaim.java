package com.example.evidenceledger.models;

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

/**
 * Uniqueness index for evidence fingerprints. Written in the same transaction as the evidence it
 * points to, guarded by {@code attribute_not_exists(fingerprint)}.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@Getter @Setter
public class FingerprintClaim {

    @NonNull
    private String fingerprint;

    @NonNull
    private Long evidenceId;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("fingerprint")
    public String getFingerprint() { return fingerprint; }

    @DynamoDbAttribute("evidence_id")
    public Long getEvidenceId() { return evidenceId; }
}
