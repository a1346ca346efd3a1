package com.example.evidenceledger.service;

/**
 * Outcome of {@link CustodyPolicyValidator#validate}. A rejection names the violated rule and a
 * human-readable detail.
 */
public record PolicyDecision(
        boolean accepted,
        EvidenceLedgerException.Code violation,
        String detail
) {

    private static final PolicyDecision ACCEPTED = new PolicyDecision(true, null, null);

    public static PolicyDecision accept() {
        return ACCEPTED;
    }

    public static PolicyDecision reject(EvidenceLedgerException.Code violation, String detail) {
        return new PolicyDecision(false, violation, detail);
    }
}
