package com.arbitration.award.model;

public record KeyMilestone(AuditAction action, String description, long timestamp) {}
