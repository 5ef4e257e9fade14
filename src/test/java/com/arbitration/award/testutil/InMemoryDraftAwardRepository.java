package com.arbitration.award.testutil;

import com.arbitration.award.model.DraftAward;
import com.arbitration.award.repository.DraftAwardRepository;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Mirrors Aerospike generation semantics: every write bumps the generation, and a save carrying
 * a non-zero generation only lands on a record still at that generation.
 */
public class InMemoryDraftAwardRepository implements DraftAwardRepository {

    private final ConcurrentMap<String, DraftAward> drafts = new ConcurrentHashMap<>();

    @Override
    public boolean insert(DraftAward draft) {
        return drafts.putIfAbsent(draft.getCaseId(), draft.toBuilder().generation(1).build()) == null;
    }

    @Override
    public boolean save(DraftAward draft) {
        boolean[] saved = {false};
        drafts.compute(draft.getCaseId(), (key, current) -> {
            if (current != null && draft.getGeneration() > 0 && current.getGeneration() != draft.getGeneration()) {
                return current;
            }
            saved[0] = true;
            int generation = current != null ? current.getGeneration() + 1 : 1;
            return draft.toBuilder().generation(generation).build();
        });
        return saved[0];
    }

    @Override
    public DraftAward findByCaseId(String caseId) {
        DraftAward stored = drafts.get(caseId);
        return stored != null ? stored.toBuilder().build() : null;
    }
}
