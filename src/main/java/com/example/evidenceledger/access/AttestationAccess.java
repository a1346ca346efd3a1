package com.example.evidenceledger.access;

import com.example.evidenceledger.models.Attestation;
import java.util.List;

public interface AttestationAccess {

    /**
     * Stores a new attestation. Will fail with DUPLICATE_ATTESTATION if the verifier already
     * attested the same evidence item.
     */
    Attestation create(Attestation attestation);

    /**
     * Attestations for an evidence item in arrival order.
     */
    List<Attestation> findAllByEvidenceId(long evidenceId);
}
