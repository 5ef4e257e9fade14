package com.arbitration.award.service;

import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.StateConflictException;
import com.arbitration.award.model.AwardContent;
import com.arbitration.award.model.ChangeType;
import com.arbitration.award.model.DraftAward;
import com.arbitration.award.model.DraftAwardRevision;
import com.arbitration.award.repository.RevisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Append-only version history of draft awards. Versions start at 1 and are allocated by an
 * atomic counter in the store, never by reading the current maximum.
 */
@Service
public class RevisionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(RevisionLedgerService.class);

    static final String INITIAL_SUMMARY = "Initial AI-generated draft award";

    private final RevisionRepository revisionRepository;

    public RevisionLedgerService(RevisionRepository revisionRepository) {
        this.revisionRepository = revisionRepository;
    }

    /**
     * Record version 1 for a freshly generated draft. Calling it again returns the existing
     * version 1 untouched.
     */
    public DraftAwardRevision createInitialRevision(DraftAward draft, String authorId) {
        revisionRepository.initializeCounter(draft.getId());

        DraftAwardRevision initial = DraftAwardRevision.builder()
                .id(UUID.randomUUID().toString())
                .draftAwardId(draft.getId())
                .version(1)
                .content(draft.getContent())
                .changeType(ChangeType.INITIAL)
                .changeSummary(INITIAL_SUMMARY)
                .changedFields(Collections.emptyList())
                .authorId(authorId)
                .createdAt(System.currentTimeMillis())
                .build();

        if (revisionRepository.insert(initial)) {
            log.info("Initial revision recorded for draft {}", draft.getId());
            return initial;
        }
        log.debug("Initial revision for draft {} already exists", draft.getId());
        return revisionRepository.find(draft.getId(), 1);
    }

    public DraftAwardRevision appendRevision(String draftAwardId, AwardContent snapshot, ChangeType changeType,
                                             String changeSummary, List<String> changedFields, String authorId) {
        int version = revisionRepository.allocateVersion(draftAwardId);

        DraftAwardRevision revision = DraftAwardRevision.builder()
                .id(UUID.randomUUID().toString())
                .draftAwardId(draftAwardId)
                .version(version)
                .content(snapshot)
                .changeType(changeType)
                .changeSummary(changeSummary)
                .changedFields(changedFields != null ? List.copyOf(changedFields) : Collections.emptyList())
                .authorId(authorId)
                .createdAt(System.currentTimeMillis())
                .build();

        if (!revisionRepository.insert(revision)) {
            // only possible if the counter was reset underneath existing revisions
            throw new StateConflictException(
                    "Revision " + version + " of draft " + draftAwardId + " already exists");
        }
        log.info("Revision v{} ({}) recorded for draft {} by {}", version, changeType, draftAwardId, authorId);
        return revision;
    }

    /**
     * All revisions, newest first.
     */
    public List<DraftAwardRevision> getHistory(String draftAwardId) {
        List<DraftAwardRevision> history = new ArrayList<>(revisionRepository.findAll(draftAwardId));
        Collections.reverse(history);
        return history;
    }

    public DraftAwardRevision getRevision(String draftAwardId, int version) {
        DraftAwardRevision revision = revisionRepository.find(draftAwardId, version);
        if (revision == null) {
            throw new NotFoundException("Revision " + version + " not found for draft award " + draftAwardId);
        }
        return revision;
    }

    public int currentVersion(String draftAwardId) {
        return revisionRepository.currentVersion(draftAwardId);
    }

    public boolean hasRevisions(String draftAwardId) {
        return currentVersion(draftAwardId) > 0;
    }
}
