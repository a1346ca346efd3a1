package com.example.evidenceledger.service;

import com.example.evidenceledger.access.LedgerEventAccess;
import com.example.evidenceledger.models.LedgerEvent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryLedgerEventAccess implements LedgerEventAccess {

    private final ConcurrentHashMap<String, LedgerEvent> events = new ConcurrentHashMap<>();
    private volatile boolean failing;

    void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void put(LedgerEvent event) {
        if (failing) {
            throw new IllegalStateException("ledger_events table unavailable");
        }
        String key = event.getEvidenceId() + "#" + event.getSequence();
        if (events.putIfAbsent(key, event) != null) {
            throw new IllegalStateException("sequence " + key + " already written");
        }
    }

    @Override
    public Optional<LedgerEvent> findLatest(long evidenceId) {
        return events.values().stream()
                .filter(e -> e.getEvidenceId() == evidenceId)
                .max(Comparator.comparing(LedgerEvent::getSequence));
    }

    @Override
    public List<LedgerEvent> findAllByEvidenceId(long evidenceId) {
        return events.values().stream()
                .filter(e -> e.getEvidenceId() == evidenceId)
                .sorted(Comparator.comparing(LedgerEvent::getSequence))
                .toList();
    }

    /** Replaces a stored event without recomputing its hash. */
    void overwrite(LedgerEvent event) {
        events.put(event.getEvidenceId() + "#" + event.getSequence(), event);
    }

    List<LedgerEvent.EventType> typesFor(long evidenceId) {
        List<LedgerEvent.EventType> types = new ArrayList<>();
        findAllByEvidenceId(evidenceId).forEach(e -> types.add(e.getEventType()));
        return types;
    }
}
