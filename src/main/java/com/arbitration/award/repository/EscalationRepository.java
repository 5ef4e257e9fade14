package com.arbitration.award.repository;

import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.EscalationStatus;

import java.util.List;

/**
 * Escalations keyed by draft award id. Returned records carry the generation they were read at,
 * which {@link #replace} checks before writing.
 */
public interface EscalationRepository {

    AwardEscalation findByDraftAwardId(String draftAwardId);

    AwardEscalation findById(String escalationId);

    List<AwardEscalation> findByStatus(EscalationStatus status);

    /**
     * Returns false if an escalation already exists for the draft.
     */
    boolean insert(AwardEscalation escalation);

    /**
     * Overwrite the record only if it is still at {@code escalation.getGeneration()}.
     *
     * @return false if another writer changed it first
     */
    boolean replace(AwardEscalation escalation);
}
