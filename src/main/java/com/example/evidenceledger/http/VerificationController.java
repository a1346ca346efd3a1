package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Attestation;
import com.example.evidenceledger.models.Verifier;
import com.example.evidenceledger.requests.AttestHttpRequest;
import com.example.evidenceledger.requests.VerifyEvidenceHttpRequest;
import com.example.evidenceledger.requests.VerifyEvidenceServiceRequest;
import com.example.evidenceledger.service.AttestationAggregator;
import com.example.evidenceledger.service.VerificationEngine;
import com.example.evidenceledger.service.VerificationOutcome;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for fingerprint verification and independent verifier attestations.
 * A failed verification is still a 200: the mismatch is the result, and it has been recorded.
 */
@RestController
public class VerificationController {

    private final VerificationEngine verificationEngine;
    private final AttestationAggregator attestationAggregator;

    public VerificationController(VerificationEngine verificationEngine,
                                  AttestationAggregator attestationAggregator) {
        this.verificationEngine = verificationEngine;
        this.attestationAggregator = attestationAggregator;
    }

    @PostMapping("/evidence/{evidenceId}/verifications")
    public ResponseEntity<VerificationResponse> verify(
            @PathVariable long evidenceId,
            @Valid @RequestBody VerifyEvidenceHttpRequest request
    ) {
        VerificationOutcome outcome = verificationEngine.verify(new VerifyEvidenceServiceRequest(
                evidenceId,
                ContentPayloads.decodeContent(request.content()),
                ContentPayloads.parseFingerprint(request.fingerprint()),
                request.verifier()
        ));
        return ResponseEntity.ok(new VerificationResponse(
                outcome.evidenceId(),
                outcome.verifier(),
                outcome.passed(),
                outcome.expectedFingerprint(),
                outcome.submittedFingerprint()
        ));
    }

    @PutMapping("/verifiers/{verifier}")
    public ResponseEntity<VerifierResponse> registerVerifier(@PathVariable String verifier) {
        Verifier registered = attestationAggregator.registerVerifier(verifier);
        return ResponseEntity.ok(new VerifierResponse(registered.getVerifier(), registered.getRegisteredAt()));
    }

    @PostMapping("/evidence/{evidenceId}/attestations")
    public ResponseEntity<AttestationResponse> attest(
            @PathVariable long evidenceId,
            @Valid @RequestBody AttestHttpRequest request
    ) {
        Attestation attestation = attestationAggregator.attest(evidenceId, request.verifier(), request.verified());
        return ResponseEntity.ok(map(attestation));
    }

    @GetMapping("/evidence/{evidenceId}/attestations")
    public ResponseEntity<AttestationsResponse> getAttestations(@PathVariable long evidenceId) {
        List<AttestationResponse> attestations = attestationAggregator.getAttestations(evidenceId).stream()
                .map(this::map)
                .toList();
        long confirmed = attestations.stream().filter(AttestationResponse::verified).count();
        return ResponseEntity.ok(new AttestationsResponse(
                attestations,
                attestations.size(),
                confirmed,
                attestations.size() - confirmed
        ));
    }

    private AttestationResponse map(Attestation attestation) {
        return new AttestationResponse(
                attestation.getEvidenceId(),
                attestation.getVerifier(),
                attestation.getAttestationIndex(),
                attestation.getVerified(),
                attestation.getTimestamp()
        );
    }
}
