package com.example.evidenceledger.service;

import lombok.Getter;

public class EvidenceLedgerException extends RuntimeException {

    public enum Category {
        INPUT,
        NOT_FOUND,
        CONFLICT,
        POLICY,
        COMMIT
    }

    public enum Code {
        INVALID_INPUT(Category.INPUT),
        INVALID_FINGERPRINT(Category.INPUT),
        INVALID_CASE_ID(Category.INPUT),

        EVIDENCE_NOT_FOUND(Category.NOT_FOUND),
        INDEX_OUT_OF_BOUNDS(Category.NOT_FOUND),

        DUPLICATE_FINGERPRINT(Category.CONFLICT),
        DUPLICATE_ATTESTATION(Category.CONFLICT),

        INVALID_CUSTODY_ORDER(Category.POLICY),
        PARALLEL_ACCESS_VIOLATION(Category.POLICY),
        ACCESS_DURATION_EXCEEDED(Category.POLICY),
        NOT_REGISTERED_VERIFIER(Category.POLICY),

        LEDGER_COMMIT_FAILED(Category.COMMIT);

        @Getter
        private final Category category;

        Code(Category category) {
            this.category = category;
        }
    }

    @Getter
    private final Code code;

    /** Index of the VIOLATION custody event written for a rejected custody action, if any. */
    @Getter
    private final Long violationEventIndex;

    private EvidenceLedgerException(Code code, String message, Long violationEventIndex, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.violationEventIndex = violationEventIndex;
    }

    private EvidenceLedgerException(Code code, String message) {
        this(code, message, null, null);
    }

    public Category getCategory() {
        return code.getCategory();
    }

    public static EvidenceLedgerException invalidInput(String message) {
        return new EvidenceLedgerException(Code.INVALID_INPUT, message);
    }

    public static EvidenceLedgerException invalidFingerprint(String message) {
        return new EvidenceLedgerException(Code.INVALID_FINGERPRINT, message);
    }

    public static EvidenceLedgerException invalidCaseId() {
        return new EvidenceLedgerException(Code.INVALID_CASE_ID, "Case ID must be non-empty");
    }

    public static EvidenceLedgerException evidenceNotFound(long evidenceId) {
        return new EvidenceLedgerException(Code.EVIDENCE_NOT_FOUND,
                "Evidence " + evidenceId + " does not exist");
    }

    public static EvidenceLedgerException custodyIndexOutOfBounds(long evidenceId, long index, long count) {
        return new EvidenceLedgerException(Code.INDEX_OUT_OF_BOUNDS,
                "Custody event index " + index + " is out of range for evidence " + evidenceId
                        + " (count " + count + ")");
    }

    public static EvidenceLedgerException attestationIndexOutOfBounds(long evidenceId, long index, long count) {
        return new EvidenceLedgerException(Code.INDEX_OUT_OF_BOUNDS,
                "Attestation index " + index + " is out of range for evidence " + evidenceId
                        + " (count " + count + ")");
    }

    public static EvidenceLedgerException duplicateFingerprint(String fingerprintHex) {
        return new EvidenceLedgerException(Code.DUPLICATE_FINGERPRINT,
                "Fingerprint " + fingerprintHex + " is already registered");
    }

    public static EvidenceLedgerException duplicateAttestation(long evidenceId, String verifier) {
        return new EvidenceLedgerException(Code.DUPLICATE_ATTESTATION,
                "Verifier " + verifier + " already attested evidence " + evidenceId);
    }

    public static EvidenceLedgerException notRegisteredVerifier(String verifier) {
        return new EvidenceLedgerException(Code.NOT_REGISTERED_VERIFIER,
                "Verifier " + verifier + " is not registered");
    }

    /**
     * A custody policy rejection. {@code violationEventIndex} is the index of the VIOLATION record
     * appended in place of the rejected action.
     */
    public static EvidenceLedgerException policyViolation(Code code, String detail, long violationEventIndex) {
        if (code.getCategory() != Category.POLICY) {
            throw new IllegalArgumentException(code + " is not a policy violation");
        }
        return new EvidenceLedgerException(code, detail, violationEventIndex, null);
    }

    public static EvidenceLedgerException commitFailed(String message, Throwable cause) {
        return new EvidenceLedgerException(Code.LEDGER_COMMIT_FAILED, message, null, cause);
    }
}
