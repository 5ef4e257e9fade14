package com.arbitration.award.testutil;

import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.gateway.NotificationGateway;
import com.arbitration.award.model.NotificationTemplate;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures sent notifications. Users added with {@link #failFor} get a delivery failure instead.
 */
public class RecordingNotificationGateway implements NotificationGateway {

    public record Sent(String userId, NotificationTemplate template, String subject) {}

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();

    @Override
    public void send(String userId, NotificationTemplate template, String subject, String body,
                     Map<String, Object> metadata) {
        if (failing.contains(userId)) {
            throw new ExternalServiceException("twilio", "Simulated delivery failure for " + userId, null);
        }
        sent.add(new Sent(userId, template, subject));
    }

    public void failFor(String userId) {
        failing.add(userId);
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<String> recipients() {
        return sent.stream().map(Sent::userId).toList();
    }
}
