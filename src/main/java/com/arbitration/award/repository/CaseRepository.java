package com.arbitration.award.repository;

import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.CaseStatus;

public interface CaseRepository {

    CaseRecord findById(String caseId);

    void save(CaseRecord caseRecord);

    void updateStatus(String caseId, CaseStatus status);
}
