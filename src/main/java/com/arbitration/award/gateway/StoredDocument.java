package com.arbitration.award.gateway;

/**
 * @param sha256 hex digest of the bytes as stored
 */
public record StoredDocument(String url, String sha256, long size) {}
