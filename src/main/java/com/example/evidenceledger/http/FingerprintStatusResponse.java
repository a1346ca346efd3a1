package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Fingerprint;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FingerprintStatusResponse(
        @JsonProperty("fingerprint") Fingerprint fingerprint,
        @JsonProperty("registered") boolean registered
) { }
