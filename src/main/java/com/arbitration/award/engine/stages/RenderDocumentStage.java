package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.gateway.AwardDocumentRenderer;
import com.arbitration.award.gateway.AwardDocumentRequest;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class RenderDocumentStage implements FinalizationStage {

    private final AwardDocumentRenderer renderer;

    public RenderDocumentStage(AwardDocumentRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public String name() {
        return "render-document";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.ABORT;
    }

    @Override
    public void execute(FinalizationContext context) {
        byte[] document = renderer.render(new AwardDocumentRequest(
                context.getReferenceNumber(),
                context.getCaseRecord(),
                context.getDraft().getContent(),
                context.arbitratorName(),
                context.getIssuedAt()));
        if (document == null || document.length == 0) {
            throw new ExternalServiceException(name(), "Renderer produced an empty award document", null);
        }
        context.setDocument(document);
        context.setContentType(renderer.contentType());
    }
}
