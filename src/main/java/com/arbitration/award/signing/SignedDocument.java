package com.arbitration.award.signing;

/**
 * Detached signature over a rendered award document.
 *
 * @param signatureValue Base64 signature bytes
 * @param signerPublicKey Base64 X.509 SubjectPublicKeyInfo of the signing key
 */
public record SignedDocument(byte[] document,
                             String signatureValue,
                             String signatureAlgorithm,
                             String certificateFingerprint,
                             String signerPublicKey,
                             long signedAt,
                             TimestampToken timestamp) {

    public SignedDocument withTimestamp(TimestampToken token) {
        return new SignedDocument(document, signatureValue, signatureAlgorithm, certificateFingerprint,
                signerPublicKey, signedAt, token);
    }

    public boolean timestampGranted() {
        return timestamp != null && timestamp.granted();
    }
}
