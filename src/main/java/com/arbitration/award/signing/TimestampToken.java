package com.arbitration.award.signing;

/**
 * Outcome of an RFC 3161 timestamp request. A denied or failed request is represented by
 * {@link #notGranted}, never by an exception.
 */
public record TimestampToken(boolean granted, byte[] token, Long genTime, String authority) {

    public static TimestampToken notGranted(String authority) {
        return new TimestampToken(false, null, null, authority);
    }
}
