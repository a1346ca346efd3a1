package com.example.evidenceledger.service;

import com.example.evidenceledger.access.CustodyEventAccess;
import com.example.evidenceledger.access.EvidenceAccess;
import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Append-only store of evidence anchors and their chain-of-custody logs.
 *
 * <p>Every mutation runs inside the {@link LedgerCommitLog} and is written through a single atomic
 * access call, so an operation either commits completely or leaves the ledger untouched.
 * Notifications are emitted only after the write succeeded.
 */
@Service
@Slf4j
public class LedgerStore {

    private final EvidenceAccess evidenceAccess;
    private final CustodyEventAccess custodyEventAccess;
    private final ActionRegistry actions;
    private final LedgerNotificationService notifications;
    private final LedgerCommitLog commitLog;
    private final Clock clock;

    public LedgerStore(EvidenceAccess evidenceAccess,
                       CustodyEventAccess custodyEventAccess,
                       ActionRegistry actions,
                       LedgerNotificationService notifications,
                       LedgerCommitLog commitLog,
                       Clock clock) {
        this.evidenceAccess = evidenceAccess;
        this.custodyEventAccess = custodyEventAccess;
        this.actions = actions;
        this.notifications = notifications;
        this.commitLog = commitLog;
        this.clock = clock;
    }

    /**
     * Anchors a new evidence fingerprint and writes its automatic {@code COLLECTED} custody event in
     * the same commit.
     *
     * @return the stored evidence, status REGISTERED with one custody event
     */
    public Evidence registerEvidence(Fingerprint fingerprint, String caseId, String collector) {
        requireFingerprint(fingerprint, "fingerprint");
        if (caseId == null || caseId.isBlank()) {
            throw EvidenceLedgerException.invalidCaseId();
        }
        requireText(collector, "collector");

        return commitLog.inCommit(() -> {
            if (evidenceAccess.isFingerprintClaimed(fingerprint)) {
                throw EvidenceLedgerException.duplicateFingerprint(fingerprint.toHex());
            }

            long now = clock.millis();
            long evidenceId = evidenceAccess.count() + 1;
            Evidence evidence = Evidence.builder()
                    .evidenceId(evidenceId)
                    .fingerprint(fingerprint)
                    .caseId(caseId)
                    .collector(collector)
                    .registeredAt(now)
                    .status(Evidence.Status.REGISTERED)
                    .custodyEventCount(1L)
                    .build();
            CustodyEvent collected = custodyEvent(evidenceId, 0L, ActionRegistry.COLLECTED, collector,
                    Fingerprint.ZERO, now);

            evidenceAccess.create(evidence, collected);
            log.info("Registered evidence {} for case {} with fingerprint {}",
                    evidenceId, caseId, fingerprint);

            notifications.evidenceRegistered(evidence);
            notifications.custodyEventLogged(collected);
            return evidence;
        });
    }

    public CustodyEvent appendCustodyEvent(long evidenceId, String action, String handler, Fingerprint metadataHash) {
        Fingerprint metadata = metadataHash == null ? Fingerprint.ZERO : metadataHash;
        return commitLog.inCommit(() -> {
            Evidence evidence = loadEvidence(evidenceId);
            requireText(action, "action");
            requireText(handler, "handler");

            CustodyEvent event = append(evidence, evidence.getStatus(), action, handler, metadata);
            log.info("Logged custody event {} ({}) for evidence {} by {}",
                    event.getEventIndex(), action, evidenceId, handler);
            notifications.custodyEventLogged(event);
            return event;
        });
    }

    /**
     * Compares {@code submitted} with the registered fingerprint. A match marks the evidence
     * VERIFIED and appends a {@code VERIFIED} custody event; a mismatch marks it FLAGGED without
     * touching the custody log.
     */
    public VerificationOutcome recordVerification(long evidenceId, Fingerprint submitted, String verifier) {
        requireFingerprint(submitted, "submitted fingerprint");
        return commitLog.inCommit(() -> {
            Evidence evidence = loadEvidence(evidenceId);
            requireText(verifier, "verifier");

            if (evidence.matches(submitted)) {
                CustodyEvent event = append(evidence, Evidence.Status.VERIFIED, ActionRegistry.VERIFIED,
                        verifier, submitted);
                log.info("Evidence {} verified by {}", evidenceId, verifier);
                notifications.verificationPassed(evidenceId, verifier, submitted);
                notifications.custodyEventLogged(event);
                return new VerificationOutcome(evidenceId, verifier, true, evidence.getFingerprint(), submitted);
            }

            evidenceAccess.updateStatus(evidence.toBuilder()
                    .status(Evidence.Status.FLAGGED)
                    .build());
            log.warn("Tamper detected on evidence {} by {}: expected {} but got {}",
                    evidenceId, verifier, evidence.getFingerprint(), submitted);
            notifications.tamperDetected(evidenceId, verifier, evidence.getFingerprint(), submitted);
            return new VerificationOutcome(evidenceId, verifier, false, evidence.getFingerprint(), submitted);
        });
    }

    public Evidence getEvidence(long evidenceId) {
        return loadEvidence(evidenceId);
    }

    /**
     * Like {@link #getEvidence} but empty instead of failing for an unknown id.
     */
    public Optional<Evidence> findEvidence(long evidenceId) {
        if (evidenceId <= 0) {
            return Optional.empty();
        }
        return evidenceAccess.findById(evidenceId)
                .filter(e -> e.getStatus() != Evidence.Status.UNSET);
    }

    public CustodyEvent getCustodyEvent(long evidenceId, long index) {
        Evidence evidence = loadEvidence(evidenceId);
        long count = evidence.getCustodyEventCount();
        if (index < 0 || index >= count) {
            throw EvidenceLedgerException.custodyIndexOutOfBounds(evidenceId, index, count);
        }
        return custodyEventAccess.find(evidenceId, index)
                .orElseThrow(() -> EvidenceLedgerException.custodyIndexOutOfBounds(evidenceId, index, count));
    }

    public long getCustodyEventCount(long evidenceId) {
        return loadEvidence(evidenceId).getCustodyEventCount();
    }

    public List<CustodyEvent> getCustodyEvents(long evidenceId) {
        loadEvidence(evidenceId);
        return custodyEventAccess.findAllByEvidenceId(evidenceId);
    }

    public boolean isFingerprintRegistered(Fingerprint fingerprint) {
        requireFingerprint(fingerprint, "fingerprint");
        return evidenceAccess.isFingerprintClaimed(fingerprint);
    }

    public long getEvidenceCount() {
        return evidenceAccess.count();
    }

    private CustodyEvent append(Evidence evidence,
                                Evidence.Status newStatus,
                                String action,
                                String handler,
                                Fingerprint metadata) {
        Evidence updated = evidence.withCustodyEventAppended(newStatus);
        CustodyEvent event = custodyEvent(evidence.getEvidenceId(), evidence.getCustodyEventCount(),
                action, handler, metadata, clock.millis());
        evidenceAccess.appendCustodyEvent(updated, event);
        return event;
    }

    private CustodyEvent custodyEvent(long evidenceId,
                                      long eventIndex,
                                      String action,
                                      String handler,
                                      Fingerprint metadata,
                                      long timestamp) {
        return CustodyEvent.builder()
                .evidenceId(evidenceId)
                .eventIndex(eventIndex)
                .handler(handler)
                .action(action)
                .actionFingerprint(actions.actionFingerprint(action))
                .timestamp(timestamp)
                .metadataHash(metadata)
                .build();
    }

    private Evidence loadEvidence(long evidenceId) {
        return findEvidence(evidenceId)
                .orElseThrow(() -> EvidenceLedgerException.evidenceNotFound(evidenceId));
    }

    private static void requireFingerprint(Fingerprint fingerprint, String name) {
        if (fingerprint == null || fingerprint.isZero()) {
            throw EvidenceLedgerException.invalidFingerprint(name + " must be a non-zero 32-byte value");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw EvidenceLedgerException.invalidInput(name + " must be non-empty");
        }
    }
}
