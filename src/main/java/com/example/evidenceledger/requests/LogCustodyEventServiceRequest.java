package com.example.evidenceledger.requests;

import com.example.evidenceledger.service.EvidenceLedgerException;
import java.util.Map;

/**
 * A proposed custody action. {@code details} is optional free-form metadata; only its canonical
 * fingerprint is stored.
 */
public record LogCustodyEventServiceRequest(
        long evidenceId,
        String action,
        String handler,
        Map<String, Object> details
) {
    public LogCustodyEventServiceRequest {
        if (action == null || action.isBlank()) {
            throw EvidenceLedgerException.invalidInput("action must be non-empty");
        }
        if (handler == null || handler.isBlank()) {
            throw EvidenceLedgerException.invalidInput("handler must be non-empty");
        }
    }
}
