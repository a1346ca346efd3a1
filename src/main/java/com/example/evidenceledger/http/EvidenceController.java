package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Evidence;
import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.requests.RegisterEvidenceHttpRequest;
import com.example.evidenceledger.requests.RegisterEvidenceServiceRequest;
import com.example.evidenceledger.service.CustodyService;
import com.example.evidenceledger.service.LedgerStore;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for anchoring evidence and looking up anchors.
 */
@RestController
public class EvidenceController {

    private final CustodyService custodyService;
    private final LedgerStore ledgerStore;

    public EvidenceController(CustodyService custodyService, LedgerStore ledgerStore) {
        this.custodyService = custodyService;
        this.ledgerStore = ledgerStore;
    }

    @PostMapping("/evidence")
    public ResponseEntity<EvidenceResponse> registerEvidence(@Valid @RequestBody RegisterEvidenceHttpRequest request) {
        RegisterEvidenceServiceRequest registerRequest = new RegisterEvidenceServiceRequest(
                ContentPayloads.decodeContent(request.content()),
                ContentPayloads.parseFingerprint(request.fingerprint()),
                request.caseId(),
                request.collector()
        );

        Evidence evidence = custodyService.registerEvidence(registerRequest);
        return ResponseEntity.created(URI.create("/evidence/" + evidence.getEvidenceId()))
                .body(map(evidence));
    }

    @GetMapping("/evidence/{evidenceId}")
    public ResponseEntity<EvidenceResponse> getEvidence(@PathVariable long evidenceId) {
        return ResponseEntity.ok(map(ledgerStore.getEvidence(evidenceId)));
    }

    @GetMapping("/fingerprints/{fingerprint}")
    public ResponseEntity<FingerprintStatusResponse> getFingerprintStatus(@PathVariable String fingerprint) {
        Fingerprint parsed = Fingerprint.fromHex(fingerprint);
        return ResponseEntity.ok(new FingerprintStatusResponse(parsed, ledgerStore.isFingerprintRegistered(parsed)));
    }

    private EvidenceResponse map(Evidence evidence) {
        return new EvidenceResponse(
                evidence.getEvidenceId(),
                evidence.getFingerprint(),
                evidence.getCaseId(),
                evidence.getCollector(),
                evidence.getRegisteredAt(),
                evidence.getStatus(),
                evidence.getCustodyEventCount()
        );
    }
}
