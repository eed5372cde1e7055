package uk.gegc.quotaledger.features.quota.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.quotaledger.features.quota.application.StaleSessionReclaimer;

/**
 * Runs the stale session reclaimer on a fixed delay. The startup sweep lives in
 * {@link StaleSessionStartupReclaim} so it does not depend on timers being enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = {"app.scheduling.enabled", "quota.reclaim.enabled"}, havingValue = "true", matchIfMissing = true)
public class StaleSessionSweepScheduler {

    private final StaleSessionReclaimer reclaimer;

    @Scheduled(initialDelayString = "${quota.reclaim.fixed-delay-ms:900000}",
            fixedDelayString = "${quota.reclaim.fixed-delay-ms:900000}")
    public void sweep() {
        try {
            reclaimer.reclaim();
        } catch (Exception e) {
            log.warn("StaleSessionSweepScheduler: error during stale session sweep", e);
        }
    }
}
