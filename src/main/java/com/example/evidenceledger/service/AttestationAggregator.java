package com.example.evidenceledger.service;

import com.example.evidenceledger.access.AttestationAccess;
import com.example.evidenceledger.access.VerifierAccess;
import com.example.evidenceledger.models.Attestation;
import com.example.evidenceledger.models.Verifier;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collects independent attestations from registered verifiers, at most one per verifier per
 * evidence item, and reports the raw consensus counts.
 */
@Service
@Slf4j
public class AttestationAggregator {

    static final String ATTEST_ACTION = "ATTEST";

    private final AttestationAccess attestationAccess;
    private final VerifierAccess verifierAccess;
    private final LedgerStore ledgerStore;
    private final LedgerNotificationService notifications;
    private final LedgerCommitLog commitLog;
    private final Clock clock;

    public AttestationAggregator(AttestationAccess attestationAccess,
                                 VerifierAccess verifierAccess,
                                 LedgerStore ledgerStore,
                                 LedgerNotificationService notifications,
                                 LedgerCommitLog commitLog,
                                 Clock clock) {
        this.attestationAccess = attestationAccess;
        this.verifierAccess = verifierAccess;
        this.ledgerStore = ledgerStore;
        this.notifications = notifications;
        this.commitLog = commitLog;
        this.clock = clock;
    }

    /**
     * Registers a verifier identity. Registering an existing identity is a no-op that returns the
     * original registration.
     */
    public Verifier registerVerifier(String verifier) {
        if (verifier == null || verifier.isBlank()) {
            throw EvidenceLedgerException.invalidInput("verifier must be non-empty");
        }
        return verifierAccess.saveIfAbsent(Verifier.builder()
                .verifier(verifier)
                .registeredAt(clock.millis())
                .build());
    }

    public boolean isRegisteredVerifier(String verifier) {
        return verifier != null && verifierAccess.findByVerifier(verifier).isPresent();
    }

    public Attestation attest(long evidenceId, String verifier, boolean verified) {
        return commitLog.inCommit(() -> {
            if (!isRegisteredVerifier(verifier)) {
                throw recordUnregisteredAttempt(evidenceId, verifier);
            }
            ledgerStore.getEvidence(evidenceId);

            List<Attestation> existing = attestationAccess.findAllByEvidenceId(evidenceId);
            if (existing.stream().anyMatch(a -> a.getVerifier().equals(verifier))) {
                throw EvidenceLedgerException.duplicateAttestation(evidenceId, verifier);
            }

            Attestation attestation = attestationAccess.create(Attestation.builder()
                    .evidenceId(evidenceId)
                    .verifier(verifier)
                    .attestationIndex((long) existing.size())
                    .verified(verified)
                    .timestamp(clock.millis())
                    .build());
            log.info("Verifier {} attested evidence {} as {}", verifier, evidenceId,
                    verified ? "intact" : "compromised");
            notifications.verificationAttested(attestation);
            return attestation;
        });
    }

    private EvidenceLedgerException recordUnregisteredAttempt(long evidenceId, String verifier) {
        EvidenceLedgerException rejection = EvidenceLedgerException.notRegisteredVerifier(verifier);
        // unknown evidence has no chain to record on, and an anonymous caller has no actor
        if (verifier != null && !verifier.isBlank() && ledgerStore.findEvidence(evidenceId).isPresent()) {
            log.warn("Rejected attestation of evidence {} by unregistered verifier {}", evidenceId, verifier);
            notifications.policyViolation(evidenceId, verifier, ATTEST_ACTION,
                    rejection.getCode(), rejection.getMessage(), null);
        }
        return rejection;
    }

    public long getAttestationCount(long evidenceId) {
        return getAttestations(evidenceId).size();
    }

    public Attestation getAttestation(long evidenceId, long index) {
        List<Attestation> attestations = getAttestations(evidenceId);
        if (index < 0 || index >= attestations.size()) {
            throw EvidenceLedgerException.attestationIndexOutOfBounds(evidenceId, index, attestations.size());
        }
        return attestations.get((int) index);
    }

    public List<Attestation> getAttestations(long evidenceId) {
        ledgerStore.getEvidence(evidenceId);
        return attestationAccess.findAllByEvidenceId(evidenceId);
    }

    public Consensus getConsensus(long evidenceId) {
        List<Attestation> attestations = getAttestations(evidenceId);
        long confirmed = attestations.stream().filter(Attestation::getVerified).count();
        return new Consensus(attestations.size(), confirmed, attestations.size() - confirmed);
    }

    /**
     * Raw attestation counts; no quorum is implied.
     */
    public record Consensus(long total, long confirmed, long denied) { }
}
