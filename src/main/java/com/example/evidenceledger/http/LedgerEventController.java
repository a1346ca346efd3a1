package com.example.evidenceledger.http;

import com.example.evidenceledger.models.LedgerEvent;
import com.example.evidenceledger.service.LedgerNotificationService;
import com.example.evidenceledger.service.LedgerStore;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to an evidence item's notification history, with the result of re-checking
 * its hash chain.
 */
@RestController
public class LedgerEventController {

    private final LedgerNotificationService notificationService;
    private final LedgerStore ledgerStore;

    public LedgerEventController(LedgerNotificationService notificationService, LedgerStore ledgerStore) {
        this.notificationService = notificationService;
        this.ledgerStore = ledgerStore;
    }

    @GetMapping("/evidence/{evidenceId}/ledger-events")
    public ResponseEntity<LedgerEventsResponse> getLedgerEvents(@PathVariable long evidenceId) {
        ledgerStore.getEvidence(evidenceId);
        List<LedgerEventResponse> events = notificationService.findAll(evidenceId).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new LedgerEventsResponse(events, notificationService.verifyChain(evidenceId)));
    }

    private LedgerEventResponse map(LedgerEvent event) {
        return new LedgerEventResponse(
                event.getEvidenceId(),
                event.getSequence(),
                event.getEventType(),
                event.getActor(),
                event.getRequestId(),
                event.getTimestamp(),
                event.getPrevHash(),
                event.getHash(),
                event.getDetails()
        );
    }
}
