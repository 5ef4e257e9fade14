package com.arbitration.award.service;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.exception.ValidationException;
import com.arbitration.award.model.AuditAction;
import com.arbitration.award.model.AuditCategory;
import com.arbitration.award.model.AuditExport;
import com.arbitration.award.model.AuditLogEntry;
import com.arbitration.award.model.AuditSummary;
import com.arbitration.award.model.AuditTrailEntry;
import com.arbitration.award.model.CaseAuditOverview;
import com.arbitration.award.model.CaseAuditTrail;
import com.arbitration.award.model.CaseRecord;
import com.arbitration.award.model.ChainVerification;
import com.arbitration.award.model.ExportFormat;
import com.arbitration.award.model.IntegrityStatus;
import com.arbitration.award.model.KeyMilestone;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.repository.CaseRepository;
import com.arbitration.award.repository.UserRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Case-level views over the audit chain: the annotated timeline shown to compliance reviewers
 * and its JSON/CSV exports.
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    static final String CSV_HEADER = "Timestamp,Action,Description,Category,User,Role,IP Address,Hash";
    private static final long DAY_MS = 24L * 60 * 60 * 1000;
    private static final String UNREADABLE_DESCRIPTION = "Unreadable audit entry";

    private final AuditChainService auditChainService;
    private final CaseRepository caseRepository;
    private final UserRepository userRepository;
    private final AwardConfig awardConfig;
    private final ObjectMapper objectMapper;

    public AuditTrailService(AuditChainService auditChainService,
                             CaseRepository caseRepository,
                             UserRepository userRepository,
                             AwardConfig awardConfig) {
        this.auditChainService = auditChainService;
        this.caseRepository = caseRepository;
        this.userRepository = userRepository;
        this.awardConfig = awardConfig;
        this.objectMapper = new ObjectMapper();
    }

    @Observed(name = "audit.timeline", contextualName = "build-case-timeline")
    public CaseAuditTrail getCaseTimeline(String caseId) {
        CaseRecord caseRecord = caseRepository.findById(caseId);
        if (caseRecord == null) {
            throw new NotFoundException("Case not found");
        }

        List<AuditLogEntry> logs = auditChainService.findByCaseId(caseId);

        Set<String> actorIds = new LinkedHashSet<>();
        for (AuditLogEntry entry : logs) {
            if (entry.getActorId() != null) {
                actorIds.add(entry.getActorId());
            }
        }
        Map<String, UserAccount> users = actorIds.isEmpty()
                ? Collections.emptyMap()
                : userRepository.findByIds(actorIds);

        List<AuditTrailEntry> entries = new ArrayList<>(logs.size());
        for (AuditLogEntry entry : logs) {
            UserAccount actor = entry.getActorId() != null ? users.get(entry.getActorId()) : null;
            AuditAction action = entry.getAction();
            entries.add(AuditTrailEntry.builder()
                    .id(entry.getId())
                    .sequence(entry.getSequence())
                    .timestamp(entry.getTimestamp())
                    .action(action)
                    .actionDescription(action != null ? action.getDescription() : UNREADABLE_DESCRIPTION)
                    .category(action != null ? action.getCategory() : null)
                    .actorId(entry.getActorId())
                    .actorName(actor != null ? actor.getDisplayName() : null)
                    .actorRole(actor != null ? actor.getRole() : null)
                    .ipAddress(entry.getIpAddress())
                    .userAgent(entry.getUserAgent())
                    .metadata(entry.getMetadata() != null ? entry.getMetadata() : Collections.emptyMap())
                    .hash(entry.getHash())
                    .build());
        }

        ChainVerification integrity = auditChainService.verifyLinked(logs);
        if (!integrity.isValid()) {
            log.warn("Audit trail for case {} has {} invalid entries",
                    caseId, integrity.invalidEntries().size());
        }

        long now = System.currentTimeMillis();
        return CaseAuditTrail.builder()
                .caseId(caseId)
                .caseReference(caseRecord.getReferenceNumber())
                .caseStatus(caseRecord.getStatus())
                .entries(entries)
                .summary(summarize(entries, now))
                .integrityStatus(integrity.isValid() ? IntegrityStatus.INTACT : IntegrityStatus.BROKEN)
                .integrityFailures(integrity.invalidEntries())
                .generatedAt(now)
                .build();
    }

    public AuditExport exportTimeline(String caseId, ExportFormat format, String userId) {
        CaseAuditTrail trail = getCaseTimeline(caseId);
        if (trail.getEntries().size() > awardConfig.getAudit().getExportMaxEntries()) {
            throw new ValidationException("Audit trail has " + trail.getEntries().size()
                    + " entries, more than the export limit of " + awardConfig.getAudit().getExportMaxEntries());
        }

        String base = "audit-trail-" + (trail.getCaseReference() != null ? trail.getCaseReference() : caseId);
        AuditExport export = switch (format) {
            case JSON -> new AuditExport(format, "application/json", base + ".json", toJson(trail), trail);
            case CSV -> new AuditExport(format, "text/csv", base + ".csv", toCsv(trail), trail);
            case PRINT -> new AuditExport(format, "application/json", base + ".json", null, trail);
        };

        auditChainService.append(AuditAction.AUDIT_LOG_EXPORTED, userId, caseId,
                Map.of("format", format.name(), "entryCount", trail.getEntries().size()));
        log.info("Exported {} audit entries for case {} as {}", trail.getEntries().size(), caseId, format);
        return export;
    }

    /**
     * Lightweight per-case overview for compliance dashboards. Unknown case ids are skipped.
     */
    public List<CaseAuditOverview> summarizeCases(List<String> caseIds) {
        List<CaseAuditOverview> overviews = new ArrayList<>();
        for (String caseId : caseIds) {
            CaseRecord caseRecord = caseRepository.findById(caseId);
            if (caseRecord == null) {
                continue;
            }
            List<AuditLogEntry> logs = auditChainService.findByCaseId(caseId);
            Long lastActivity = logs.isEmpty() ? null : logs.get(logs.size() - 1).getTimestamp();
            boolean broken = !auditChainService.verifyLinked(logs).isValid();
            overviews.add(new CaseAuditOverview(caseId, caseRecord.getReferenceNumber(), logs.size(),
                    lastActivity, broken));
        }
        return overviews;
    }

    AuditSummary summarize(List<AuditTrailEntry> entries, long now) {
        Map<AuditCategory, Integer> byCategory = new EnumMap<>(AuditCategory.class);
        for (AuditCategory category : AuditCategory.values()) {
            byCategory.put(category, 0);
        }
        List<KeyMilestone> milestones = new ArrayList<>();
        for (AuditTrailEntry entry : entries) {
            if (entry.getAction() == null) {
                continue;
            }
            byCategory.merge(entry.getCategory(), 1, Integer::sum);
            if (entry.getAction().isMilestone()) {
                milestones.add(new KeyMilestone(entry.getAction(), entry.getActionDescription(), entry.getTimestamp()));
            }
        }

        Long first = entries.isEmpty() ? null : entries.get(0).getTimestamp();
        Long last = entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp();
        long durationDays = first == null ? 0 : (long) Math.ceil((now - first) / (double) DAY_MS);

        return AuditSummary.builder()
                .totalEvents(entries.size())
                .eventsByCategory(byCategory)
                .keyMilestones(milestones)
                .firstEventAt(first)
                .lastEventAt(last)
                .durationDays(durationDays)
                .build();
    }

    private String toJson(CaseAuditTrail trail) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(trail);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit trail for case " + trail.getCaseId(), e);
        }
    }

    String toCsv(CaseAuditTrail trail) {
        StringBuilder csv = new StringBuilder(CSV_HEADER);
        for (AuditTrailEntry entry : trail.getEntries()) {
            csv.append('\n')
                    .append(csvField(Instant.ofEpochMilli(entry.getTimestamp()).toString())).append(',')
                    .append(csvField(entry.getAction() != null ? entry.getAction().name() : null)).append(',')
                    .append(csvField(entry.getActionDescription())).append(',')
                    .append(csvField(entry.getCategory() != null ? entry.getCategory().name() : null)).append(',')
                    .append(csvField(entry.getActorName())).append(',')
                    .append(csvField(entry.getActorRole() != null ? entry.getActorRole().name() : null)).append(',')
                    .append(csvField(entry.getIpAddress())).append(',')
                    .append(csvField(entry.getHash()));
        }
        return csv.toString();
    }

    static String csvField(String value) {
        String v = Objects.toString(value, "");
        if (v.indexOf(',') >= 0 || v.indexOf('"') >= 0 || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0) {
            return '"' + v.replace("\"", "\"\"") + '"';
        }
        return v;
    }
}
