package com.example.evidenceledger.access;

import com.example.evidenceledger.models.CustodyEvent;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the custody log. Writes go through {@link EvidenceAccess} so they commit together
 * with the evidence record's custody count.
 */
public interface CustodyEventAccess {

    Optional<CustodyEvent> find(long evidenceId, long eventIndex);

    /**
     * All custody events for an evidence item, ordered by event index ascending.
     */
    List<CustodyEvent> findAllByEvidenceId(long evidenceId);
}
