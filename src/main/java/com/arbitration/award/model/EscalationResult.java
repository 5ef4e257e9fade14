package com.arbitration.award.model;

public record EscalationResult(String escalationId, EscalationStatus status, String assignedTo) {}
