package uk.gegc.quotaledger.features.quota.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import uk.gegc.quotaledger.features.quota.api.dto.ReclaimedSessionDto;
import uk.gegc.quotaledger.features.quota.application.StaleSessionReclaimer;

import java.util.List;

/**
 * Closes sessions left active by a previous process once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "quota.reclaim.on-startup", havingValue = "true", matchIfMissing = true)
public class StaleSessionStartupReclaim {

    private final StaleSessionReclaimer reclaimer;

    @EventListener(ApplicationReadyEvent.class)
    public void reclaimOnStartup() {
        try {
            List<ReclaimedSessionDto> reclaimed = reclaimer.reclaim();
            log.info("Startup reclaim closed {} stale session(s)", reclaimed.size());
        } catch (Exception e) {
            log.warn("StaleSessionStartupReclaim: error during startup reclaim", e);
        }
    }
}
