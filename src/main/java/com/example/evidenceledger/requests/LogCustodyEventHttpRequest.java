package com.example.evidenceledger.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogCustodyEventHttpRequest(
        @JsonProperty("action") @NotBlank String action,
        @JsonProperty("handler") @NotBlank String handler,
        @JsonProperty("details") Map<String, Object> details
) {}
