package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.gateway.SigningCredentialsProvider;
import com.arbitration.award.gateway.TimestampAuthority;
import com.arbitration.award.signing.Digests;
import com.arbitration.award.signing.DocumentSigner;
import com.arbitration.award.signing.SignedDocument;
import com.arbitration.award.signing.SigningCredentials;
import com.arbitration.award.signing.TimestampToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Signs the rendered document with the arbitrator's key and asks the timestamp authority for a
 * token over its digest. Missing credentials or a signing error abort; a timestamp failure only
 * leaves the award without a token.
 */
@Component
@Order(3)
public class SignDocumentStage implements FinalizationStage {

    private static final Logger log = LoggerFactory.getLogger(SignDocumentStage.class);

    private final SigningCredentialsProvider credentialsProvider;
    private final DocumentSigner signer;
    private final TimestampAuthority timestampAuthority;

    public SignDocumentStage(SigningCredentialsProvider credentialsProvider, DocumentSigner signer,
                             TimestampAuthority timestampAuthority) {
        this.credentialsProvider = credentialsProvider;
        this.signer = signer;
        this.timestampAuthority = timestampAuthority;
    }

    @Override
    public String name() {
        return "sign-document";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.ABORT;
    }

    @Override
    public void execute(FinalizationContext context) throws Exception {
        SigningCredentials credentials = credentialsProvider.getCredentials(context.getArbitratorId());
        SignedDocument signed = signer.sign(context.getDocument(), credentials);

        TimestampToken token;
        try {
            token = timestampAuthority.timestamp(Digests.sha256(context.getDocument()));
        } catch (Exception e) {
            log.warn("Timestamping failed for {}, continuing without token: {}",
                    context.getReferenceNumber(), e.getMessage());
            token = null;
        }
        if (token == null || !token.granted()) {
            log.info("Award {} signed without RFC 3161 timestamp", context.getReferenceNumber());
        }

        context.setSignedDocument(signed.withTimestamp(token));
    }
}
