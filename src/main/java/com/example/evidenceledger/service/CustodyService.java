package com.example.evidenceledger.service;

import com.example.evidenceledger.config.CustodyPolicyProperties;
import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.requests.LogCustodyEventServiceRequest;
import com.example.evidenceledger.requests.RegisterEvidenceServiceRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Calling-layer gate in front of the {@link LedgerStore}: every proposed custody action is checked
 * by the {@link CustodyPolicyValidator} first. A rejected action is never dropped silently; a
 * {@code VIOLATION} custody event is appended in its place and the caller gets the rejection.
 */
@Service
@Slf4j
public class CustodyService {

    private final LedgerStore ledgerStore;
    private final CustodyPolicyValidator validator;
    private final CustodyPolicyProperties policy;
    private final FingerprintUtility fingerprints;
    private final LedgerNotificationService notifications;
    private final LedgerCommitLog commitLog;
    private final Clock clock;

    public CustodyService(LedgerStore ledgerStore,
                          CustodyPolicyValidator validator,
                          CustodyPolicyProperties policy,
                          FingerprintUtility fingerprints,
                          LedgerNotificationService notifications,
                          LedgerCommitLog commitLog,
                          Clock clock) {
        this.ledgerStore = ledgerStore;
        this.validator = validator;
        this.policy = policy;
        this.fingerprints = fingerprints;
        this.notifications = notifications;
        this.commitLog = commitLog;
        this.clock = clock;
    }

    /**
     * Registers evidence from raw content or a precomputed fingerprint and seeds the policy state
     * with the initial COLLECTED step.
     */
    public Evidence registerEvidence(RegisterEvidenceServiceRequest request) {
        Objects.requireNonNull(request, "request");
        Fingerprint fingerprint = request.fingerprint() != null
                ? request.fingerprint()
                : fingerprints.digest(request.content());

        return commitLog.inCommit(() -> {
            Evidence evidence = ledgerStore.registerEvidence(fingerprint, request.caseId(), request.collector());
            validator.validate(evidence.getEvidenceId(), ActionRegistry.COLLECTED, evidence.getCollector(), null);
            return evidence;
        });
    }

    public CustodyEvent logCustodyEvent(long evidenceId, String action, String handler, Map<String, Object> details) {
        return logCustodyEvent(new LogCustodyEventServiceRequest(evidenceId, action, handler, details));
    }

    /**
     * Validates and appends a custody action.
     *
     * @return the appended custody event
     * @throws EvidenceLedgerException with a POLICY code when the action was rejected; its
     *         {@code violationEventIndex} points at the VIOLATION record written instead
     */
    public CustodyEvent logCustodyEvent(LogCustodyEventServiceRequest request) {
        Objects.requireNonNull(request, "request");
        long evidenceId = request.evidenceId();

        return commitLog.inCommit(() -> {
            Evidence evidence = ledgerStore.getEvidence(evidenceId);
            if (!policy.isEnabled()) {
                return ledgerStore.appendCustodyEvent(evidenceId, request.action(), request.handler(),
                        metadataOf(request.details()));
            }

            if (!validator.isTracking(evidenceId)) {
                validator.rehydrate(evidenceId, evidence.getFingerprint(), ledgerStore.getCustodyEvents(evidenceId));
            }

            CustodyPolicyValidator.Checkpoint checkpoint = validator.checkpoint(evidenceId);
            PolicyDecision decision = validator.validate(evidenceId, request.action(), request.handler(),
                    request.details());
            if (!decision.accepted()) {
                throw recordViolation(request, decision);
            }

            try {
                return ledgerStore.appendCustodyEvent(evidenceId, request.action(), request.handler(),
                        metadataOf(request.details()));
            } catch (RuntimeException ex) {
                // nothing was committed, so the accepted step never happened
                validator.restore(checkpoint);
                throw ex;
            }
        });
    }

    /**
     * Clears the active checkout. Runs in the commit so it cannot interleave with a custody action
     * that is being validated and appended.
     */
    public void releaseCheckout(long evidenceId) {
        commitLog.inCommit(() -> {
            ledgerStore.getEvidence(evidenceId);
            validator.releaseCheckout(evidenceId);
            log.info("Released checkout on evidence {}", evidenceId);
            return null;
        });
    }

    private EvidenceLedgerException recordViolation(LogCustodyEventServiceRequest request, PolicyDecision decision) {
        Map<String, Object> violation = new LinkedHashMap<>();
        violation.put("violationType", decision.violation().name());
        violation.put("details", decision.detail());
        violation.put("timestamp", clock.instant());

        CustodyEvent violationEvent = ledgerStore.appendCustodyEvent(request.evidenceId(), ActionRegistry.VIOLATION,
                request.handler(), fingerprints.digestStructured(violation));

        log.warn("Policy violation {} on evidence {}: {} by {} rejected ({}), recorded as event {}",
                decision.violation(), request.evidenceId(), request.action(), request.handler(),
                decision.detail(), violationEvent.getEventIndex());
        notifications.policyViolation(request.evidenceId(), request.handler(), request.action(),
                decision.violation(), decision.detail(), violationEvent.getEventIndex());

        return EvidenceLedgerException.policyViolation(decision.violation(), decision.detail(),
                violationEvent.getEventIndex());
    }

    private Fingerprint metadataOf(Map<String, Object> details) {
        return details == null ? Fingerprint.ZERO : fingerprints.digestStructured(details);
    }
}
