package com.arbitration.award.gateway;

import com.arbitration.award.model.NotificationTemplate;

import java.util.Map;

/**
 * Delivers a message to a user. Returns normally only on confirmed hand-off to the channel;
 * any failure is thrown so the caller can decide whether it matters.
 */
public interface NotificationGateway {

    void send(String userId, NotificationTemplate template, String subject, String body,
              Map<String, Object> metadata);
}
