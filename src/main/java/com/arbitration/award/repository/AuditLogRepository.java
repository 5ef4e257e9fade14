package com.arbitration.award.repository;

import com.arbitration.award.model.AuditLogEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The global audit chain, one record per sequence number.
 */
public interface AuditLogRepository {

    /**
     * Insert the entry at its sequence. Returns false if that position is already taken.
     */
    boolean insert(AuditLogEntry entry);

    AuditLogEntry findBySequence(long sequence);

    Map<Long, AuditLogEntry> findBySequences(Collection<Long> sequences);

    /**
     * Entries with sequence in [from, to], ascending. Missing positions are skipped.
     */
    List<AuditLogEntry> findRange(long from, long to);

    /**
     * All entries for a case, ascending by sequence.
     */
    List<AuditLogEntry> findByCaseId(String caseId);

    /**
     * Last sequence known to be written. May lag the true tail.
     */
    long readTailHint();

    void updateTailHint(long sequence);
}
