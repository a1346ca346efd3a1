package com.example.evidenceledger.access;

import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import java.util.Optional;

/**
 * Storage abstraction for evidence anchors. Every write is a single atomic commit that also
 * covers the custody log entry it implies, so an evidence record and its log can never drift.
 */
public interface EvidenceAccess {

    Optional<Evidence> findById(long evidenceId);

    /**
     * Number of evidence records ever registered; also the highest allocated id.
     */
    long count();

    boolean isFingerprintClaimed(Fingerprint fingerprint);

    /**
     * Atomically stores a new evidence record, its genesis custody event, the fingerprint claim
     * and the advanced id sequence.
     *
     * @throws com.example.evidenceledger.service.EvidenceLedgerException DUPLICATE_FINGERPRINT when
     *         the fingerprint was claimed first, LEDGER_COMMIT_FAILED when the id was taken
     */
    void create(Evidence evidence, CustodyEvent genesisEvent);

    /**
     * Atomically stores {@code event} and the evidence record whose custody count already
     * includes it. Fails with LEDGER_COMMIT_FAILED if another writer appended first.
     */
    void appendCustodyEvent(Evidence updated, CustodyEvent event);

    /**
     * Stores a status change that leaves the custody count untouched.
     */
    void updateStatus(Evidence updated);
}
