package com.example.evidenceledger.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record LedgerEventsResponse(
        @JsonProperty("events") List<LedgerEventResponse> events,
        @JsonProperty("chain_valid") boolean chainValid
) { }
