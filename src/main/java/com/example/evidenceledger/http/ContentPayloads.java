package com.example.evidenceledger.http;

import com.example.evidenceledger.models.Fingerprint;
import com.example.evidenceledger.service.EvidenceLedgerException;
import java.util.Base64;

/**
 * Decoding of the {@code content} / {@code fingerprint} pair shared by registration and
 * verification payloads.
 */
final class ContentPayloads {

    private ContentPayloads() {
    }

    static byte[] decodeContent(String base64) {
        if (base64 == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException ex) {
            throw EvidenceLedgerException.invalidInput("content must be base64: " + ex.getMessage());
        }
    }

    static Fingerprint parseFingerprint(String hex) {
        return hex == null ? null : Fingerprint.fromHex(hex);
    }
}
