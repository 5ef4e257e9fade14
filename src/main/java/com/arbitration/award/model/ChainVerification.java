package com.arbitration.award.model;

import java.util.List;

/**
 * Result of re-verifying a run of audit entries.
 *
 * @param contiguous false when the sequence numbers have a gap
 */
public record ChainVerification(boolean isValid, int totalEntries, List<InvalidEntry> invalidEntries,
                                boolean contiguous) {

    public record InvalidEntry(String id, long sequence, String reason) {}
}
