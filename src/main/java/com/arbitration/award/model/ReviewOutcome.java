package com.arbitration.award.model;

public record ReviewOutcome(String draftAwardId, ReviewStatus reviewStatus, String message, String nextStep) {}
