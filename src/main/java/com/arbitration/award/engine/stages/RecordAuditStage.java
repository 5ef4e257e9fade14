package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.Award;
import com.arbitration.award.service.AuditChainService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Order(8)
public class RecordAuditStage implements FinalizationStage {

    private final AuditChainService auditChainService;

    public RecordAuditStage(AuditChainService auditChainService) {
        this.auditChainService = auditChainService;
    }

    @Override
    public String name() {
        return "record-audit";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.CONTINUE;
    }

    @Override
    public void execute(FinalizationContext context) {
        Award award = context.getAward();

        Map<String, Object> signed = new LinkedHashMap<>();
        signed.put("awardId", award.getId());
        signed.put("referenceNumber", award.getReferenceNumber());
        signed.put("signatureAlgorithm", award.getSignatureAlgorithm());
        signed.put("certificateFingerprint", award.getCertificateFingerprint());
        signed.put("documentHash", award.getDocumentHash());
        signed.put("timestampGranted", award.isTimestampGranted());
        auditChainService.append(AuditAction.AWARD_SIGNED, context.getArbitratorId(), context.getCaseId(),
                signed, context.getIpAddress(), context.getUserAgent());

        Map<String, Object> issued = new LinkedHashMap<>();
        issued.put("awardId", award.getId());
        issued.put("referenceNumber", award.getReferenceNumber());
        issued.put("awardAmount", award.getContent().getAwardAmount() != null
                ? award.getContent().getAwardAmount().toPlainString() : null);
        issued.put("prevailingParty", award.getContent().getPrevailingParty() != null
                ? award.getContent().getPrevailingParty().name() : null);
        issued.put("claimantNotified", context.isClaimantNotified());
        issued.put("respondentNotified", context.isRespondentNotified());
        auditChainService.append(AuditAction.AWARD_ISSUED, context.getArbitratorId(), context.getCaseId(),
                issued, context.getIpAddress(), context.getUserAgent());
    }
}
