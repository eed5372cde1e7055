package uk.gegc.quotaledger.features.quota.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quotaledger.features.quota.application.QuotaMetricsService;

/**
 * Micrometer counters for the quota engine. Per-resource counters are tagged with the
 * resource type; Micrometer caches the meter per tag set.
 */
@Slf4j
@Service
public class QuotaMetricsServiceImpl implements QuotaMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter sessionsReclaimedCounter;

    public QuotaMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.sessionsReclaimedCounter = Counter.builder("quota.sessions.reclaimed")
                .description("Number of stale sessions closed without charge")
                .register(meterRegistry);
    }

    @Override
    public void incrementUsageCharged(String resourceType, long amount) {
        log.debug("METRIC: quota.usage.charged resourceType={} amount={}", resourceType, amount);
        Counter.builder("quota.usage.charged")
                .description("Credit units charged for completed usage")
                .tag("resourceType", safe(resourceType))
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void incrementSessionStarted(String resourceType) {
        log.debug("METRIC: quota.sessions.started resourceType={}", resourceType);
        Counter.builder("quota.sessions.started")
                .description("Number of usage sessions opened")
                .tag("resourceType", safe(resourceType))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionCompleted(String resourceType) {
        log.debug("METRIC: quota.sessions.completed resourceType={}", resourceType);
        Counter.builder("quota.sessions.completed")
                .description("Number of usage sessions closed and charged")
                .tag("resourceType", safe(resourceType))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementSessionsReclaimed(int count) {
        log.debug("METRIC: quota.sessions.reclaimed count={}", count);
        sessionsReclaimedCounter.increment(count);
    }

    @Override
    public void incrementRefreshUpdated(String ruleName, int usersUpdated) {
        log.debug("METRIC: quota.refresh.updated rule={} users={}", ruleName, usersUpdated);
        Counter.builder("quota.refresh.updated")
                .description("Accounts updated by batch refresh")
                .tag("rule", safe(ruleName))
                .register(meterRegistry)
                .increment(usersUpdated);
    }

    @Override
    public void incrementGateDenied(String resourceType) {
        log.debug("METRIC: quota.gate.denied resourceType={}", resourceType);
        Counter.builder("quota.gate.denied")
                .description("Number of start checks refused for insufficient balance")
                .tag("resourceType", safe(resourceType))
                .register(meterRegistry)
                .increment();
    }

    private static String safe(String value) {
        return value == null ? "unknown" : value;
    }
}
