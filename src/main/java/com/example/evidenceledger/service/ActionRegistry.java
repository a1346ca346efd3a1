package com.example.evidenceledger.service;

import com.example.evidenceledger.models.Fingerprint;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps custody action names to the fingerprints stored on chain and back. Any string has a
 * fingerprint; only the canonical set below can be resolved from it.
 */
@Component
public class ActionRegistry {

    public static final String COLLECTED = "COLLECTED";
    public static final String ACCESSED = "ACCESSED";
    public static final String TRANSFERRED = "TRANSFERRED";
    public static final String VERIFIED = "VERIFIED";
    public static final String ANALYZED = "ANALYZED";
    public static final String VIOLATION = "VIOLATION";
    public static final String SEALED = "SEALED";

    public static final String UNKNOWN = "UNKNOWN";

    public static final List<String> CANONICAL_ACTIONS =
            List.of(COLLECTED, ACCESSED, TRANSFERRED, VERIFIED, ANALYZED, VIOLATION);

    private final FingerprintUtility fingerprints;
    private final Map<Fingerprint, String> namesByFingerprint = new LinkedHashMap<>();

    public ActionRegistry(FingerprintUtility fingerprints) {
        this.fingerprints = fingerprints;
        for (String action : CANONICAL_ACTIONS) {
            namesByFingerprint.put(fingerprints.digestString(action), action);
        }
    }

    public Fingerprint actionFingerprint(String action) {
        return fingerprints.digestString(action);
    }

    public String actionName(Fingerprint actionFingerprint) {
        if (actionFingerprint == null) {
            return UNKNOWN;
        }
        return namesByFingerprint.getOrDefault(actionFingerprint, UNKNOWN);
    }

    public boolean isCanonical(String action) {
        return action != null && CANONICAL_ACTIONS.contains(action);
    }
}
