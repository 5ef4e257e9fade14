package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.Award;
import com.arbitration.award.repository.AwardRepository;
import com.arbitration.award.signing.SignedDocument;
import com.arbitration.award.signing.TimestampToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.UUID;

/**
 * The commit point: a create-only insert keyed by case id. When two finalizations race, exactly one
 * insert succeeds and the other gets a state conflict.
 */
@Component
@Order(5)
public class PersistAwardStage implements FinalizationStage {

    private static final Logger log = LoggerFactory.getLogger(PersistAwardStage.class);

    private final AwardRepository awardRepository;

    public PersistAwardStage(AwardRepository awardRepository) {
        this.awardRepository = awardRepository;
    }

    @Override
    public String name() {
        return "persist-award";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.ABORT;
    }

    @Override
    public void execute(FinalizationContext context) {
        SignedDocument signed = context.getSignedDocument();
        TimestampToken token = signed.timestamp();
        boolean granted = signed.timestampGranted();

        Award award = Award.builder()
                .id(UUID.randomUUID().toString())
                .caseId(context.getCaseId())
                .referenceNumber(context.getReferenceNumber())
                .content(context.getDraft().getContent())
                .arbitratorId(context.getArbitratorId())
                .signedAt(signed.signedAt())
                .issuedAt(context.getIssuedAt())
                .signatureValue(signed.signatureValue())
                .signatureAlgorithm(signed.signatureAlgorithm())
                .certificateFingerprint(signed.certificateFingerprint())
                .signerPublicKey(signed.signerPublicKey())
                .timestampGranted(granted)
                .timestampToken(granted ? Base64.getEncoder().encodeToString(token.token()) : null)
                .timestampTime(granted ? token.genTime() : null)
                .timestampAuthority(granted ? token.authority() : null)
                .documentUrl(context.getStoredDocument().url())
                .documentHash(context.getStoredDocument().sha256())
                .build();

        if (!awardRepository.insert(award)) {
            log.warn("Lost issuance race for case {}; reference {} discarded",
                    context.getCaseId(), context.getReferenceNumber());
            throw new StateConflictException("Award has already been issued for this case");
        }
        context.setAward(award);
        log.info("Award {} issued for case {} as {}", award.getId(), context.getCaseId(), award.getReferenceNumber());
    }
}
