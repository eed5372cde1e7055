package uk.gegc.quotaledger.features.quota.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshRequest;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshResultDto;
import uk.gegc.quotaledger.features.quota.application.QuotaProperties;
import uk.gegc.quotaledger.features.quota.application.QuotaRefreshService;

/**
 * Registers one cron task per {@code quota.refresh.rules[n]} entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class RefreshRuleScheduler implements SchedulingConfigurer {

    static final String SCHEDULER_ACTOR = "scheduler";

    private final QuotaRefreshService refreshService;
    private final QuotaProperties quotaProperties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        for (QuotaProperties.Rule rule : quotaProperties.getRefresh().getRules()) {
            taskRegistrar.addCronTask(() -> runRule(rule), rule.getCron());
            log.info("Scheduled quota refresh rule '{}' with cron '{}'", rule.getName(), rule.getCron());
        }
    }

    RefreshResultDto runRule(QuotaProperties.Rule rule) {
        RefreshRequest request = new RefreshRequest(
                rule.getName(),
                rule.getAction(),
                rule.getAmount(),
                rule.getMaxBalance(),
                rule.getMinBalance(),
                rule.targets(),
                SCHEDULER_ACTOR);
        try {
            return refreshService.refresh(request);
        } catch (Exception e) {
            log.warn("RefreshRuleScheduler: rule '{}' failed", rule.getName(), e);
            return null;
        }
    }
}
