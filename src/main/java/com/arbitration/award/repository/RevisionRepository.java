package com.arbitration.award.repository;

import com.arbitration.award.model.DraftAwardRevision;

import java.util.List;

/**
 * Append-only store of draft revisions. No update or delete exists.
 */
public interface RevisionRepository {

    /**
     * Create the per-draft version counter at 1 if it does not exist yet.
     *
     * @return true if this call created it
     */
    boolean initializeCounter(String draftAwardId);

    /**
     * Atomically increment the per-draft version counter and return the new value.
     */
    int allocateVersion(String draftAwardId);

    /**
     * Highest version allocated so far, 0 if none.
     */
    int currentVersion(String draftAwardId);

    /**
     * Insert a revision at its (draftAwardId, version) key. Returns false if that version exists.
     */
    boolean insert(DraftAwardRevision revision);

    DraftAwardRevision find(String draftAwardId, int version);

    /**
     * All stored revisions of a draft, ascending by version.
     */
    List<DraftAwardRevision> findAll(String draftAwardId);
}
