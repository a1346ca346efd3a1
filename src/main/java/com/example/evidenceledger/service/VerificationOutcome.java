package com.example.evidenceledger.service;

import com.example.evidenceledger.models.Fingerprint;

/**
 * Result of comparing a submitted fingerprint against the registered one.
 */
public record VerificationOutcome(
        long evidenceId,
        String verifier,
        boolean passed,
        Fingerprint expectedFingerprint,
        Fingerprint submittedFingerprint
) { }
