package com.example.evidenceledger.service;

import com.example.evidenceledger.access.CustodyEventAccess;
import com.example.evidenceledger.access.EvidenceAccess;
import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evidence, custody log, fingerprint claims and id counter in one place, with the same
 * all-or-nothing write semantics as the DynamoDB transactions.
 */
class InMemoryEvidenceAccess implements EvidenceAccess, CustodyEventAccess {

    private final Map<Long, Evidence> evidence = new HashMap<>();
    private final Map<Long, List<CustodyEvent>> custody = new HashMap<>();
    private final Map<Fingerprint, Long> claims = new HashMap<>();
    private long counter;
    private RuntimeException nextWriteFailure;

    /** Makes the next write fail with {@code failure} before anything is stored. */
    synchronized void failNextWrite(RuntimeException failure) {
        this.nextWriteFailure = failure;
    }

    @Override
    public synchronized Optional<Evidence> findById(long evidenceId) {
        return Optional.ofNullable(evidence.get(evidenceId));
    }

    @Override
    public synchronized long count() {
        return counter;
    }

    @Override
    public synchronized boolean isFingerprintClaimed(Fingerprint fingerprint) {
        return claims.containsKey(fingerprint);
    }

    @Override
    public synchronized void create(Evidence created, CustodyEvent genesisEvent) {
        throwPendingFailure();
        if (claims.containsKey(created.getFingerprint())) {
            throw EvidenceLedgerException.duplicateFingerprint(created.getFingerprint().toHex());
        }
        if (created.getEvidenceId() != counter + 1) {
            throw EvidenceLedgerException.commitFailed("id race", null);
        }
        counter = created.getEvidenceId();
        claims.put(created.getFingerprint(), created.getEvidenceId());
        evidence.put(created.getEvidenceId(), created);
        List<CustodyEvent> log = new ArrayList<>();
        log.add(genesisEvent);
        custody.put(created.getEvidenceId(), log);
    }

    @Override
    public synchronized void appendCustodyEvent(Evidence updated, CustodyEvent event) {
        throwPendingFailure();
        Evidence current = evidence.get(updated.getEvidenceId());
        if (current == null || current.getCustodyEventCount() != updated.getCustodyEventCount() - 1) {
            throw EvidenceLedgerException.commitFailed("count race", null);
        }
        evidence.put(updated.getEvidenceId(), updated);
        custody.get(updated.getEvidenceId()).add(event);
    }

    @Override
    public synchronized void updateStatus(Evidence updated) {
        throwPendingFailure();
        Evidence current = evidence.get(updated.getEvidenceId());
        if (current == null || !current.getCustodyEventCount().equals(updated.getCustodyEventCount())) {
            throw EvidenceLedgerException.commitFailed("count race", null);
        }
        evidence.put(updated.getEvidenceId(), updated);
    }

    @Override
    public synchronized Optional<CustodyEvent> find(long evidenceId, long eventIndex) {
        List<CustodyEvent> log = custody.getOrDefault(evidenceId, List.of());
        if (eventIndex < 0 || eventIndex >= log.size()) {
            return Optional.empty();
        }
        return Optional.of(log.get((int) eventIndex));
    }

    @Override
    public synchronized List<CustodyEvent> findAllByEvidenceId(long evidenceId) {
        return List.copyOf(custody.getOrDefault(evidenceId, List.of()));
    }

    private void throwPendingFailure() {
        if (nextWriteFailure != null) {
            RuntimeException failure = nextWriteFailure;
            nextWriteFailure = null;
            throw failure;
        }
    }
}
