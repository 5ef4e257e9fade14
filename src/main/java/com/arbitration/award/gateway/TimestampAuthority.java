package com.arbitration.award.gateway;

import com.arbitration.award.signing.TimestampToken;

public interface TimestampAuthority {

    /**
     * Request an RFC 3161 token over a SHA-256 digest. Implementations report refusal or
     * transport failure as a not-granted token rather than throwing.
     */
    TimestampToken timestamp(byte[] sha256Digest);
}
