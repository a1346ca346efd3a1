package com.example.evidenceledger.requests;

import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.service.EvidenceLedgerException;

public record VerifyEvidenceServiceRequest(
        long evidenceId,
        byte[] content,
        Fingerprint fingerprint,
        String verifier
) {
    public VerifyEvidenceServiceRequest {
        if ((content == null) == (fingerprint == null)) {
            throw EvidenceLedgerException.invalidInput("exactly one of content or fingerprint is required");
        }
        if (verifier == null || verifier.isBlank()) {
            throw EvidenceLedgerException.invalidInput("verifier must be non-empty");
        }
    }
}
