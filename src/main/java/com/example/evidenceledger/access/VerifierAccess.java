package com.example.evidenceledger.access;

import com.example.evidenceledger.models.Verifier;
import java.util.Optional;

public interface VerifierAccess {

    Optional<Verifier> findByVerifier(String verifier);

    /**
     * Registers a verifier once; a repeat registration returns the stored record unchanged.
     */
    Verifier saveIfAbsent(Verifier verifier);
}
