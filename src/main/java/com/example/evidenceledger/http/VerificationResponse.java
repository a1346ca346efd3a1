package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Fingerprint;
import com.fasterxml.jackson.annotation.JsonProperty;

public record VerificationResponse(
        @JsonProperty("evidence_id") long evidenceId,
        @JsonProperty("verifier") String verifier,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("expected_fingerprint") Fingerprint expectedFingerprint,
        @JsonProperty("submitted_fingerprint") Fingerprint submittedFingerprint
) { }
