package com.example.evidenceledger.service;

import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.requests.VerifyEvidenceServiceRequest;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Integrity checks of evidence content against the registered fingerprint.
 */
@Service
public class VerificationEngine {

    private final LedgerStore ledgerStore;
    private final FingerprintUtility fingerprints;

    public VerificationEngine(LedgerStore ledgerStore, FingerprintUtility fingerprints) {
        this.ledgerStore = ledgerStore;
        this.fingerprints = fingerprints;
    }

    public VerificationOutcome verify(VerifyEvidenceServiceRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.fingerprint() != null) {
            return verify(request.evidenceId(), request.fingerprint(), request.verifier());
        }
        return verify(request.evidenceId(), request.content(), request.verifier());
    }

    public VerificationOutcome verify(long evidenceId, byte[] content, String verifier) {
        return ledgerStore.recordVerification(evidenceId, fingerprints.digest(content), verifier);
    }

    public VerificationOutcome verify(long evidenceId, Fingerprint fingerprint, String verifier) {
        return ledgerStore.recordVerification(evidenceId, fingerprint, verifier);
    }
}
