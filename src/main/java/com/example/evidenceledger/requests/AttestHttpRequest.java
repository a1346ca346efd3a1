package com.example.evidenceledger.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AttestHttpRequest(
        @JsonProperty("verifier") @NotBlank String verifier,
        @JsonProperty("verified") @NotNull Boolean verified
) {}
