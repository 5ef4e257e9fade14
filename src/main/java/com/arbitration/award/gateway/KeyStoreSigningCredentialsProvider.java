package com.arbitration.award.gateway;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.signing.SigningCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;

/**
 * Loads arbitrator keys from a PKCS12 keystore, one entry per arbitrator id used as the alias.
 * Falls back to {@code award.signing.default-alias} when configured.
 */
@Component
public class KeyStoreSigningCredentialsProvider implements SigningCredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(KeyStoreSigningCredentialsProvider.class);

    private final AwardConfig.Signing config;
    private volatile KeyStore keyStore;

    public KeyStoreSigningCredentialsProvider(AwardConfig awardConfig) {
        this.config = awardConfig.getSigning();
    }

    @Override
    public SigningCredentials getCredentials(String arbitratorId) {
        try {
            KeyStore ks = loadKeyStore();
            String alias = ks.containsAlias(arbitratorId) ? arbitratorId : config.getDefaultAlias();
            if (alias == null || alias.isBlank() || !ks.isKeyEntry(alias)) {
                throw new ExternalServiceException("signing",
                        "No signing key available for arbitrator " + arbitratorId, null);
            }

            char[] password = password();
            PrivateKey privateKey = (PrivateKey) ks.getKey(alias, password);
            Certificate certificate = ks.getCertificate(alias);
            log.debug("Loaded signing key alias={} for arbitrator={}", alias, arbitratorId);
            return new SigningCredentials(alias, privateKey, certificate.getPublicKey(), certificate.getEncoded());
        } catch (GeneralSecurityException | IOException e) {
            throw new ExternalServiceException("signing",
                    "Failed to load signing credentials: " + e.getMessage(), e);
        }
    }

    private KeyStore loadKeyStore() throws GeneralSecurityException, IOException {
        KeyStore ks = keyStore;
        if (ks != null) return ks;

        synchronized (this) {
            if (keyStore == null) {
                if (config.getKeystorePath() == null || config.getKeystorePath().isBlank()) {
                    throw new ExternalServiceException("signing", "Signing keystore is not configured", null);
                }
                KeyStore loaded = KeyStore.getInstance(config.getKeystoreType());
                try (InputStream in = Files.newInputStream(Path.of(config.getKeystorePath()))) {
                    loaded.load(in, password());
                }
                log.info("Signing keystore loaded from {} ({} entries)", config.getKeystorePath(), loaded.size());
                keyStore = loaded;
            }
            return keyStore;
        }
    }

    private char[] password() {
        return config.getKeystorePassword() != null ? config.getKeystorePassword().toCharArray() : new char[0];
    }
}
