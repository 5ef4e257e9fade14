package com.arbitration.award.gateway;

public record StorageRequest(String folder, String caseId, String filename, String contentType) {}
