package com.example.evidenceledger.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyEvidenceHttpRequest(
        @JsonProperty("content") String content,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("verifier") @NotBlank String verifier
) {}
