package com.arbitration.award.model;

public record CaseAuditOverview(String caseId, String caseReference, int eventCount, Long lastActivity,
                                boolean hasIntegrityIssues) {}
