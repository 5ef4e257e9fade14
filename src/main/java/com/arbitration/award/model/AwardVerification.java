package com.arbitration.award.model;

public record AwardVerification(String awardId,
                                String referenceNumber,
                                boolean valid,
                                boolean documentHashMatches,
                                boolean signatureValid,
                                String expectedHash,
                                String actualHash,
                                boolean timestampGranted,
                                Long timestampTime) {}
