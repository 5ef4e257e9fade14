package com.arbitration.award.repository;

import com.arbitration.award.model.DraftAward;

/**
 * Draft awards, keyed by case id so a case can never hold two drafts. Returned drafts carry the
 * generation they were read at.
 */
public interface DraftAwardRepository {

    /**
     * Insert a new draft. Returns false when the case already has one.
     */
    boolean insert(DraftAward draft);

    /**
     * Overwrite the case's draft. A draft carrying a non-zero generation is only written if the
     * stored record is still at that generation.
     *
     * @return false when the stored draft changed since it was read
     */
    boolean save(DraftAward draft);

    DraftAward findByCaseId(String caseId);
}
