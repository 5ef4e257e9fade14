package com.arbitration.award.engine.stages;

import com.arbitration.award.engine.FinalizationContext;
import com.arbitration.award.engine.FinalizationStage;
import com.arbitration.award.engine.StageFailurePolicy;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.gateway.DocumentStorage;
import com.arbitration.award.gateway.StorageRequest;
import com.arbitration.award.gateway.StoredDocument;
import com.arbitration.award.signing.Digests;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(4)
public class StoreDocumentStage implements FinalizationStage {

    static final String FOLDER = "awards";

    private final DocumentStorage storage;

    public StoreDocumentStage(DocumentStorage storage) {
        this.storage = storage;
    }

    @Override
    public String name() {
        return "store-document";
    }

    @Override
    public StageFailurePolicy failurePolicy() {
        return StageFailurePolicy.ABORT;
    }

    @Override
    public void execute(FinalizationContext context) {
        String filename = context.getReferenceNumber() + extension(context.getContentType());
        StoredDocument stored = storage.store(context.getDocument(),
                new StorageRequest(FOLDER, context.getCaseId(), filename, context.getContentType()));

        String expected = Digests.sha256Hex(context.getDocument());
        if (!expected.equals(stored.sha256())) {
            throw new ExternalServiceException(name(),
                    "Stored document hash " + stored.sha256() + " does not match rendered document " + expected, null);
        }
        context.setStoredDocument(stored);
    }

    static String extension(String contentType) {
        if (contentType == null) return "";
        return switch (contentType) {
            case "application/pdf" -> ".pdf";
            case "text/plain" -> ".txt";
            default -> "";
        };
    }
}
