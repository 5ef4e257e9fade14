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
public class AuditTrailEntry {
    private String id;
    private long sequence;
    private long timestamp;
    private AuditAction action;
    private String actionDescription;
    private AuditCategory category;
    private String actorId;
    private String actorName;
    private UserRole actorRole;
    private String ipAddress;
    private String userAgent;
    private Map<String, Object> metadata;
    private String hash;
}
