package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.model.CaseStatus;
import com.arbitration.award.repository.CaseRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(6)
public class AdvanceCaseStatusStage implements FinalizationStage {

    private final CaseRepository caseRepository;

    public AdvanceCaseStatusStage(CaseRepository caseRepository) {
        this.caseRepository = caseRepository;
    }

    @Override
    public String name() {
        return "advance-case-status";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.CONTINUE;
    }

    @Override
    public void execute(FinalizationContext context) {
        caseRepository.updateStatus(context.getCaseId(), CaseStatus.DECIDED);
    }
}
