package com.arbitration.award.model;

/**
 * One rendered export of a case audit trail. {@code content} holds the serialized text for
 * JSON and CSV; PRINT carries only the structured {@code trail}.
 */
public record AuditExport(ExportFormat format, String contentType, String filename, String content,
                          CaseAuditTrail trail) {}
