package com.arbitration.award.model;

import java.util.List;

public record ModificationResult(String draftAwardId, int version, List<String> changedFields,
                                 String changeSummary, long modifiedAt) {}
