package com.arbitration.award.engine;

import com.arbitration.award.gateway.StoredDocument;
import com.arbitration.award.model.Award;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.signing.SignedDocument;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State carried through one finalization run. Inputs are fixed at construction; each stage fills
 * in what later stages need.
 */
@Getter
@Setter
public class FinalizationContext {

    private final String caseId;
    private final String arbitratorId;
    private final String ipAddress;
    private final String userAgent;
    private final DraftAward draft;
    private final CaseRecord caseRecord;
    private final UserAccount arbitrator;
    private final long issuedAt;

    private String referenceNumber;
    private byte[] document;
    private String contentType;
    private SignedDocument signedDocument;
    private StoredDocument storedDocument;
    private Award award;
    private boolean claimantNotified;
    private boolean respondentNotified;

    private final List<String> failedStages = new ArrayList<>();

    public FinalizationContext(String caseId, String arbitratorId, String ipAddress, String userAgent,
                               DraftAward draft, CaseRecord caseRecord, UserAccount arbitrator, long issuedAt) {
        this.caseId = caseId;
        this.arbitratorId = arbitratorId;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.draft = draft;
        this.caseRecord = caseRecord;
        this.arbitrator = arbitrator;
        this.issuedAt = issuedAt;
    }

    void recordFailure(String stageName) {
        failedStages.add(stageName);
    }

    public List<String> getFailedStages() {
        return Collections.unmodifiableList(failedStages);
    }

    public String arbitratorName() {
        return arbitrator != null && arbitrator.getDisplayName() != null ? arbitrator.getDisplayName() : arbitratorId;
    }
}
