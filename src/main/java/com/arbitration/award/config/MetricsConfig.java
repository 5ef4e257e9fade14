package com.arbitration.award.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReviewAction(String action) {
        Counter.builder("award.review.action.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String status) {
        Counter.builder("award.escalation.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFinalization(String outcome, long durationMs) {
        Counter.builder("award.finalization.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("award.finalization.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordStageFailure(String stage) {
        Counter.builder("award.finalization.stage.failure.count")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAuditAppend(String action, int attempts) {
        Counter.builder("audit.append.count")
                .tag("action", action)
                .register(registry)
                .increment();

        if (attempts > 1) {
            Counter.builder("audit.append.contention.count")
                    .register(registry)
                    .increment(attempts - 1);
        }
    }

    public void recordIntegrityCheck(boolean valid, int invalidEntries) {
        Counter.builder("audit.integrity.check.count")
                .tag("result", valid ? "intact" : "broken")
                .register(registry)
                .increment();

        if (invalidEntries > 0) {
            Counter.builder("audit.integrity.invalid.entries")
                    .register(registry)
                    .increment(invalidEntries);
        }
    }
}
