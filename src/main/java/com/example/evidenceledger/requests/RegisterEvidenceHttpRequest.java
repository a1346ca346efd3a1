package com.example.evidenceledger.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP-layer payload for POST /evidence. Carries either the raw evidence bytes (base64) or a
 * precomputed fingerprint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegisterEvidenceHttpRequest(
        @JsonProperty("content") String content,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("case_id") String caseId,
        @JsonProperty("collector") @NotBlank String collector
) {}
