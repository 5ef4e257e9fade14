package com.arbitration.award.signing;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentSignerTest {

    private final DocumentSigner signer = new DocumentSigner(new AwardConfig());
    private final SigningCredentials credentials = TestDataFactory.createCredentials("arb-1");
    private final byte[] document = "FINAL AWARD\nClaimant prevails.".getBytes(StandardCharsets.UTF_8);

    @Test
    void sign_recordsAlgorithmKeyAndFingerprint() throws Exception {
        SignedDocument signed = signer.sign(document, credentials);

        assertThat(signed.signatureAlgorithm()).isEqualTo("SHA256withRSA");
        assertThat(signed.certificateFingerprint()).isEqualTo(credentials.certificateFingerprint());
        assertThat(signed.certificateFingerprint()).hasSize(64);
        assertThat(signed.signerPublicKey())
                .isEqualTo(Base64.getEncoder().encodeToString(credentials.publicKey().getEncoded()));
        assertThat(signed.timestamp()).isNull();
        assertThat(signed.timestampGranted()).isFalse();
    }

    @Test
    void verify_acceptsUnchangedDocument() throws Exception {
        SignedDocument signed = signer.sign(document, credentials);

        assertThat(signer.verify(document, signed.signatureValue(), signed.signatureAlgorithm(),
                signed.signerPublicKey())).isTrue();
    }

    @Test
    void verify_rejectsAlteredDocument() throws Exception {
        SignedDocument signed = signer.sign(document, credentials);
        byte[] altered = "FINAL AWARD\nRespondent prevails.".getBytes(StandardCharsets.UTF_8);

        assertThat(signer.verify(altered, signed.signatureValue(), signed.signatureAlgorithm(),
                signed.signerPublicKey())).isFalse();
    }

    @Test
    void verify_malformedKey_throws() throws Exception {
        SignedDocument signed = signer.sign(document, credentials);

        assertThatThrownBy(() -> signer.verify(document, signed.signatureValue(), signed.signatureAlgorithm(),
                Base64.getEncoder().encodeToString(new byte[] {1, 2, 3})))
                .isInstanceOf(java.security.GeneralSecurityException.class);
    }

    @Test
    void withTimestamp_keepsSignature() throws Exception {
        SignedDocument signed = signer.sign(document, credentials);
        TimestampToken token = new TimestampToken(true, new byte[] {0x30, 0x00}, 1_700_000_000_000L, "tsa");

        SignedDocument stamped = signed.withTimestamp(token);

        assertThat(stamped.signatureValue()).isEqualTo(signed.signatureValue());
        assertThat(stamped.timestampGranted()).isTrue();
    }
}
