package com.example.evidenceledger.http;

import com.example.evidenceledger.models.LedgerEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerEventResponse(
        @JsonProperty("evidence_id") Long evidenceId,
        @JsonProperty("sequence") Long sequence,
        @JsonProperty("event_type") LedgerEvent.EventType eventType,
        @JsonProperty("actor") String actor,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash,
        @JsonProperty("details") Map<String, Object> details
) { }
