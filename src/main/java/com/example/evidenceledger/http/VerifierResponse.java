package com.example.evidenceledger.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VerifierResponse(
        @JsonProperty("verifier") String verifier,
        @JsonProperty("registered_at") Long registeredAt
) { }
