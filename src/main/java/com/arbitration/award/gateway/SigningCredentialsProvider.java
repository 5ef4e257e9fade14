package com.arbitration.award.gateway;

import com.arbitration.award.signing.SigningCredentials;

public interface SigningCredentialsProvider {

    /**
     * @throws com.arbitration.award.exception.ExternalServiceException if no usable key exists
     */
    SigningCredentials getCredentials(String arbitratorId);
}
