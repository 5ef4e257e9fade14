package com.arbitration.award.signing;

import com.arbitration.award.config.AwardConfig;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Produces and checks detached signatures over award documents.
 */
@Component
public class DocumentSigner {

    private final String algorithm;

    public DocumentSigner(AwardConfig awardConfig) {
        this.algorithm = awardConfig.getSigning().getAlgorithm();
    }

    public SignedDocument sign(byte[] document, SigningCredentials credentials) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(algorithm);
        signature.initSign(credentials.privateKey());
        signature.update(document);
        byte[] value = signature.sign();

        return new SignedDocument(
                document,
                Base64.getEncoder().encodeToString(value),
                algorithm,
                credentials.certificateFingerprint(),
                Base64.getEncoder().encodeToString(credentials.publicKey().getEncoded()),
                System.currentTimeMillis(),
                null);
    }

    /**
     * Check a stored signature against document bytes using the recorded public key.
     */
    public boolean verify(byte[] document, String signatureValue, String signatureAlgorithm,
                          String signerPublicKey) throws GeneralSecurityException {
        byte[] keyBytes = Base64.getDecoder().decode(signerPublicKey);
        PublicKey publicKey = KeyFactory.getInstance(keyAlgorithm(signatureAlgorithm))
                .generatePublic(new X509EncodedKeySpec(keyBytes));

        Signature signature = Signature.getInstance(signatureAlgorithm);
        signature.initVerify(publicKey);
        signature.update(document);
        return signature.verify(Base64.getDecoder().decode(signatureValue));
    }

    private static String keyAlgorithm(String signatureAlgorithm) {
        String upper = signatureAlgorithm.toUpperCase();
        if (upper.endsWith("WITHECDSA")) return "EC";
        if (upper.endsWith("WITHDSA")) return "DSA";
        return "RSA";
    }
}
