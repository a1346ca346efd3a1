package com.example.evidenceledger.requests;

import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.service.EvidenceLedgerException;

/**
 * Service-layer command for registering evidence. Exactly one of {@code content} and
 * {@code fingerprint} is set; case and collector are validated by the ledger itself.
 */
public record RegisterEvidenceServiceRequest(
        byte[] content,
        Fingerprint fingerprint,
        String caseId,
        String collector
) {

    public static RegisterEvidenceServiceRequest ofContent(byte[] content, String caseId, String collector) {
        return new RegisterEvidenceServiceRequest(content, null, caseId, collector);
    }

    public static RegisterEvidenceServiceRequest ofFingerprint(Fingerprint fingerprint, String caseId, String collector) {
        return new RegisterEvidenceServiceRequest(null, fingerprint, caseId, collector);
    }

    public RegisterEvidenceServiceRequest {
        if ((content == null) == (fingerprint == null)) {
            throw EvidenceLedgerException.invalidInput("exactly one of content or fingerprint is required");
        }
    }
}
