package com.arbitration.award.gateway;

/**
 * Turns structured award content into the document bytes that get signed and stored.
 */
public interface AwardDocumentRenderer {

    String contentType();

    byte[] render(AwardDocumentRequest request);
}
