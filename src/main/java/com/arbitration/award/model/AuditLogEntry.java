package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {
    private long sequence;                  // 1-based position in the global chain
    private String id;
    private AuditAction action;
    private String actorId;
    private String caseId;
    private Map<String, Object> metadata;
    private String ipAddress;
    private String userAgent;
    private long timestamp;
    private String previousHash;
    private String hash;
    private String readError;               // set when the stored record could not be decoded
}
