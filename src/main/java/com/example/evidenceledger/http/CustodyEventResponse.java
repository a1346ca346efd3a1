package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Fingerprint;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code action_name} is the registry's reverse lookup of the stored action fingerprint and reads
 * UNKNOWN for custom actions; {@code action} is the name as logged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustodyEventResponse(
        @JsonProperty("evidence_id") Long evidenceId,
        @JsonProperty("event_index") Long eventIndex,
        @JsonProperty("handler") String handler,
        @JsonProperty("action") String action,
        @JsonProperty("action_name") String actionName,
        @JsonProperty("action_fingerprint") Fingerprint actionFingerprint,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("metadata_hash") Fingerprint metadataHash
) { }
