package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.gateway.NotificationGateway;
import com.arbitration.award.model.Award;
import com.arbitration.award.model.NotificationTemplate;
import com.arbitration.award.model.PrevailingParty;
import com.arbitration.award.repository.AwardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Notifies claimant and respondent independently. A party's notified-at stamp is written only
 * after its delivery succeeded; one party's failure never affects the other.
 */
@Component
@Order(7)
public class NotifyPartiesStage implements FinalizationStage {

    private static final Logger log = LoggerFactory.getLogger(NotifyPartiesStage.class);

    private final NotificationGateway notificationGateway;
    private final AwardRepository awardRepository;

    public NotifyPartiesStage(NotificationGateway notificationGateway, AwardRepository awardRepository) {
        this.notificationGateway = notificationGateway;
        this.awardRepository = awardRepository;
    }

    @Override
    public String name() {
        return "notify-parties";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.CONTINUE;
    }

    @Override
    public void execute(FinalizationContext context) {
        Award award = context.getAward();
        String claimantId = context.getCaseRecord().getClaimantId();
        String respondentId = context.getCaseRecord().getRespondentId();

        context.setClaimantNotified(notifyParty(context, award, claimantId, PrevailingParty.CLAIMANT));
        if (respondentId != null) {
            context.setRespondentNotified(notifyParty(context, award, respondentId, PrevailingParty.RESPONDENT));
        }
    }

    private boolean notifyParty(FinalizationContext context, Award award, String userId, PrevailingParty party) {
        try {
            notificationGateway.send(userId, NotificationTemplate.AWARD_ISSUED,
                    "Final Award Issued",
                    "The final award for case " + context.getCaseRecord().getReferenceNumber()
                            + " has been issued. Reference: " + award.getReferenceNumber() + ".",
                    Map.of("caseId", context.getCaseId(),
                            "awardId", award.getId(),
                            "referenceNumber", award.getReferenceNumber(),
                            "documentUrl", award.getDocumentUrl()));
        } catch (Exception e) {
            log.warn("Failed to notify {} {} of award {}: {}",
                    party.name().toLowerCase(), userId, award.getReferenceNumber(), e.getMessage());
            return false;
        }

        long now = System.currentTimeMillis();
        try {
            awardRepository.markNotified(context.getCaseId(), party, now);
        } catch (Exception e) {
            log.error("Delivered award {} to {} but could not record it: {}",
                    award.getReferenceNumber(), userId, e.getMessage(), e);
            return true;
        }
        if (party == PrevailingParty.CLAIMANT) {
            award.setClaimantNotifiedAt(now);
        } else {
            award.setRespondentNotifiedAt(now);
        }
        return true;
    }
}
