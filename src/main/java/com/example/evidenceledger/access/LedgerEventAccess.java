package com.example.evidenceledger.access;

import com.example.evidenceledger.models.LedgerEvent;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only {@code ledger_events} table. Implementations persist
 * notifications and expose the latest one per evidence item so the service layer can extend the
 * hash chain.
 */
public interface LedgerEventAccess {
    void put(LedgerEvent event);
    Optional<LedgerEvent> findLatest(long evidenceId);

    /**
     * Finds all notifications for an evidence item, ordered by sequence ascending.
     *
     * @param evidenceId the evidence id to query
     * @return every notification emitted for the evidence item, oldest first
     */
    List<LedgerEvent> findAllByEvidenceId(long evidenceId);
}
