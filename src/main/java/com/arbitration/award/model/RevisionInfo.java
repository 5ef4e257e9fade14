package com.arbitration.award.model;

import java.util.List;

/**
 * Revision metadata without the content snapshot, for history listings.
 */
public record RevisionInfo(int version, ChangeType changeType, String changeSummary,
                           List<String> changedFields, String authorId, long createdAt) {

    public static RevisionInfo of(DraftAwardRevision revision) {
        return new RevisionInfo(revision.getVersion(), revision.getChangeType(),
                revision.getChangeSummary(), revision.getChangedFields(),
                revision.getAuthorId(), revision.getCreatedAt());
    }
}
