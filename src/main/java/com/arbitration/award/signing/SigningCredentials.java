package com.arbitration.award.signing;

import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Key material of one arbitrator. {@code certificateDer} is the encoded X.509 certificate whose
 * SHA-256 becomes the award's certificate fingerprint.
 */
public record SigningCredentials(String keyId, PrivateKey privateKey, PublicKey publicKey, byte[] certificateDer) {

    public String certificateFingerprint() {
        return Digests.sha256Hex(certificateDer);
    }
}
