package com.example.evidenceledger.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttestationResponse(
        @JsonProperty("evidence_id") Long evidenceId,
        @JsonProperty("verifier") String verifier,
        @JsonProperty("attestation_index") Long attestationIndex,
        @JsonProperty("verified") Boolean verified,
        @JsonProperty("timestamp") Long timestamp
) { }
