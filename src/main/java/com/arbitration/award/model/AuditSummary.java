package com.arbitration.award.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditSummary {
    private int totalEvents;
    private Map<AuditCategory, Integer> eventsByCategory;
    private List<KeyMilestone> keyMilestones;
    private Long firstEventAt;
    private Long lastEventAt;
    private long durationDays;
}
