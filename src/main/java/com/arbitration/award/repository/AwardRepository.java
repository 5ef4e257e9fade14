package com.arbitration.award.repository;

import com.arbitration.award.model.Award;
import com.arbitration.award.model.PrevailingParty;

public interface AwardRepository {

    /**
     * Insert the issued award for its case. Returns false if the case already has one.
     */
    boolean insert(Award award);

    Award findByCaseId(String caseId);

    /**
     * Stamp the notification time for one party on an existing award.
     */
    void markNotified(String caseId, PrevailingParty party, long notifiedAt);

    /**
     * Atomically increment and return the issuance counter for a UTC day ({@code yyyyMMdd}).
     */
    long nextDailySequence(String day);
}
