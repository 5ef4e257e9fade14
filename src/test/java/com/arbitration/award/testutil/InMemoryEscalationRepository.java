package com.arbitration.award.testutil;

import com.arbitration.award.model.AwardEscalation;
import com.arbitration.award.model.EscalationStatus;
import com.arbitration.award.repository.EscalationRepository;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Mirrors Aerospike generation semantics: every write bumps the generation, and {@link #replace}
 * only succeeds against the generation the caller read.
 */
public class InMemoryEscalationRepository implements EscalationRepository {

    private final ConcurrentMap<String, AwardEscalation> escalations = new ConcurrentHashMap<>();

    @Override
    public AwardEscalation findByDraftAwardId(String draftAwardId) {
        AwardEscalation stored = escalations.get(draftAwardId);
        return stored != null ? stored.toBuilder().build() : null;
    }

    @Override
    public AwardEscalation findById(String escalationId) {
        return escalations.values().stream()
                .filter(e -> e.getId().equals(escalationId))
                .findFirst()
                .map(e -> e.toBuilder().build())
                .orElse(null);
    }

    @Override
    public List<AwardEscalation> findByStatus(EscalationStatus status) {
        return escalations.values().stream()
                .filter(e -> e.getStatus() == status)
                .map(e -> e.toBuilder().build())
                .toList();
    }

    @Override
    public boolean insert(AwardEscalation escalation) {
        return escalations.putIfAbsent(escalation.getDraftAwardId(),
                escalation.toBuilder().generation(1).build()) == null;
    }

    @Override
    public boolean replace(AwardEscalation escalation) {
        boolean[] replaced = {false};
        escalations.computeIfPresent(escalation.getDraftAwardId(), (key, current) -> {
            if (current.getGeneration() != escalation.getGeneration()) {
                return current;
            }
            replaced[0] = true;
            return escalation.toBuilder().generation(current.getGeneration() + 1).build();
        });
        return replaced[0];
    }
}
