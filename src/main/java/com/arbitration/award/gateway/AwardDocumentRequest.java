package com.arbitration.award.gateway;

import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.CaseRecord;

public record AwardDocumentRequest(String referenceNumber,
                                   CaseRecord caseRecord,
                                   AwardContent content,
                                   String arbitratorName,
                                   long issuedAt) {}
