package com.example.evidenceledger.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record AttestationsResponse(
        @JsonProperty("attestations") List<AttestationResponse> attestations,
        @JsonProperty("total") long total,
        @JsonProperty("confirmed") long confirmed,
        @JsonProperty("denied") long denied
) { }
