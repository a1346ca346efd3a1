package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceResponse(
        @JsonProperty("evidence_id") Long evidenceId,
        @JsonProperty("fingerprint") Fingerprint fingerprint,
        @JsonProperty("case_id") String caseId,
        @JsonProperty("collector") String collector,
        @JsonProperty("registered_at") Long registeredAt,
        @JsonProperty("status") Evidence.Status status,
        @JsonProperty("custody_event_count") Long custodyEventCount
) { }
