package com.example.evidenceledger.http;

import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.requests.LogCustodyEventHttpRequest;
import com.example.evidenceledger.requests.LogCustodyEventServiceRequest;
import com.example.evidenceledger.service.ActionRegistry;
import com.example.evidenceledger.service.CustodyService;
import com.example.evidenceledger.service.LedgerStore;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for the chain-of-custody log. Writes go through the policy-gated
 * {@link CustodyService}; a rejected action surfaces as a 403 whose body names the VIOLATION
 * record that was logged instead.
 */
@RestController
public class CustodyController {

    private final CustodyService custodyService;
    private final LedgerStore ledgerStore;
    private final ActionRegistry actionRegistry;

    public CustodyController(CustodyService custodyService,
                             LedgerStore ledgerStore,
                             ActionRegistry actionRegistry) {
        this.custodyService = custodyService;
        this.ledgerStore = ledgerStore;
        this.actionRegistry = actionRegistry;
    }

    @PostMapping("/evidence/{evidenceId}/custody-events")
    public ResponseEntity<CustodyEventResponse> logCustodyEvent(
            @PathVariable long evidenceId,
            @Valid @RequestBody LogCustodyEventHttpRequest request
    ) {
        CustodyEvent event = custodyService.logCustodyEvent(new LogCustodyEventServiceRequest(
                evidenceId,
                request.action(),
                request.handler(),
                request.details()
        ));
        return ResponseEntity.ok(map(event));
    }

    @GetMapping("/evidence/{evidenceId}/custody-events")
    public ResponseEntity<List<CustodyEventResponse>> getCustodyEvents(@PathVariable long evidenceId) {
        List<CustodyEventResponse> response = ledgerStore.getCustodyEvents(evidenceId).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/evidence/{evidenceId}/custody-events/{index}")
    public ResponseEntity<CustodyEventResponse> getCustodyEvent(@PathVariable long evidenceId,
                                                                @PathVariable long index) {
        return ResponseEntity.ok(map(ledgerStore.getCustodyEvent(evidenceId, index)));
    }

    @DeleteMapping("/evidence/{evidenceId}/checkout")
    public ResponseEntity<Void> releaseCheckout(@PathVariable long evidenceId) {
        custodyService.releaseCheckout(evidenceId);
        return ResponseEntity.noContent().build();
    }

    private CustodyEventResponse map(CustodyEvent event) {
        return new CustodyEventResponse(
                event.getEvidenceId(),
                event.getEventIndex(),
                event.getHandler(),
                event.getAction(),
                actionRegistry.actionName(event.getActionFingerprint()),
                event.getActionFingerprint(),
                event.getTimestamp(),
                event.getMetadataHash()
        );
    }
}
