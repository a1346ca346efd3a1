package com.example.evidenceledger.service;

import com.example.evidenceledger.access.LedgerEventAccess;
import com.example.evidenceledger.models.Attestation;
import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.models.LedgerEvent;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Outbound notification stream. Every notification is persisted as a {@link LedgerEvent} on the
 * evidence item's hash chain and then published in-process.
 *
 * <p>Notifications are fired after the ledger commit they describe and are never allowed to fail
 * it: a notification that cannot be stored or published is logged and dropped.
 */
@Service
@Slf4j
public class LedgerNotificationService {

    static final String REQUEST_ID_KEY = "requestId";

    private final LedgerEventAccess ledgerEventAccess;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final boolean publish;

    public LedgerNotificationService(LedgerEventAccess ledgerEventAccess,
                                     ApplicationEventPublisher publisher,
                                     Clock clock,
                                     @Value("${ledger.notifications.publish:true}") boolean publish) {
        this.ledgerEventAccess = ledgerEventAccess;
        this.publisher = publisher;
        this.clock = clock;
        this.publish = publish;
    }

    public void evidenceRegistered(Evidence evidence) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fingerprint", evidence.getFingerprint().toHex());
        details.put("case_id", evidence.getCaseId());
        append(evidence.getEvidenceId(), LedgerEvent.EventType.EVIDENCE_REGISTERED,
                evidence.getCollector(), details);
    }

    public void custodyEventLogged(CustodyEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("event_index", event.getEventIndex());
        details.put("action", event.getAction());
        details.put("action_fingerprint", event.getActionFingerprint().toHex());
        details.put("metadata_hash", event.getMetadataHash().toHex());
        append(event.getEvidenceId(), LedgerEvent.EventType.CUSTODY_EVENT_LOGGED,
                event.getHandler(), details);
    }

    public void verificationPassed(long evidenceId, String verifier, Fingerprint fingerprint) {
        append(evidenceId, LedgerEvent.EventType.VERIFICATION_PASSED, verifier,
                Map.of("fingerprint", fingerprint.toHex()));
    }

    public void tamperDetected(long evidenceId, String verifier, Fingerprint expected, Fingerprint submitted) {
        append(evidenceId, LedgerEvent.EventType.TAMPER_DETECTED, verifier, Map.of(
                "expected_fingerprint", expected.toHex(),
                "submitted_fingerprint", submitted.toHex()));
    }

    public void verificationAttested(Attestation attestation) {
        append(attestation.getEvidenceId(), LedgerEvent.EventType.VERIFICATION_ATTESTED,
                attestation.getVerifier(), Map.of(
                        "attestation_index", attestation.getAttestationIndex(),
                        "verified", attestation.getVerified()));
    }

    /**
     * Records a rejected request. {@code violationEventIndex} is the VIOLATION custody event written
     * for a rejected custody action, or null when the rejection left the custody log untouched.
     */
    public void policyViolation(long evidenceId,
                                String handler,
                                String attemptedAction,
                                EvidenceLedgerException.Code violation,
                                String detail,
                                Long violationEventIndex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempted_action", attemptedAction);
        details.put("violation", violation.name());
        details.put("detail", detail);
        if (violationEventIndex != null) {
            details.put("event_index", violationEventIndex);
        }
        append(evidenceId, LedgerEvent.EventType.POLICY_VIOLATION, handler, details);
    }

    public List<LedgerEvent> findAll(long evidenceId) {
        return ledgerEventAccess.findAllByEvidenceId(evidenceId);
    }

    /**
     * Recomputes every hash of the evidence item's notification chain and checks each link and
     * sequence position.
     */
    public boolean verifyChain(long evidenceId) {
        String expectedPrev = LedgerEvent.GENESIS_HASH;
        long expectedSequence = 0;
        for (LedgerEvent event : ledgerEventAccess.findAllByEvidenceId(evidenceId)) {
            if (event.getSequence() != expectedSequence
                    || !expectedPrev.equals(event.getPrevHash())
                    || !event.hasValidHash()) {
                log.warn("Ledger event chain for evidence {} breaks at sequence {}",
                        evidenceId, event.getSequence());
                return false;
            }
            expectedPrev = event.getHash();
            expectedSequence++;
        }
        return true;
    }

    private void append(long evidenceId,
                        LedgerEvent.EventType type,
                        String actor,
                        Map<String, Object> details) {
        try {
            long sequence = 0;
            String prevHash = LedgerEvent.GENESIS_HASH;
            var latest = ledgerEventAccess.findLatest(evidenceId);
            if (latest.isPresent()) {
                sequence = latest.get().getSequence() + 1;
                prevHash = latest.get().getHash();
            }

            LedgerEvent event = LedgerEvent.builder()
                    .evidenceId(evidenceId)
                    .sequence(sequence)
                    .eventType(type)
                    .actor(actor)
                    .requestId(currentRequestId())
                    .timestamp(clock.millis())
                    .prevHash(prevHash)
                    .details(details)
                    .build();

            ledgerEventAccess.put(event);
            if (publish) {
                publisher.publishEvent(event);
            }
        } catch (RuntimeException ex) {
            log.error("Lost {} notification for evidence {}", type, evidenceId, ex);
        }
    }

    private static String currentRequestId() {
        String requestId = MDC.get(REQUEST_ID_KEY);
        return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }
}
