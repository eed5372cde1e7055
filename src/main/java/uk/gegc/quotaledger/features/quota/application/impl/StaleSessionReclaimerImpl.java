package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quotaledger.features.quota.api.dto.ReclaimedSessionDto;
import uk.gegc.quotaledger.features.quota.application.QuotaMetricsService;
import uk.gegc.quotaledger.features.quota.application.QuotaProperties;
import uk.gegc.quotaledger.features.quota.application.QuotaStructuredLogger;
import uk.gegc.quotaledger.features.quota.application.StaleSessionReclaimer;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSession;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus;
import uk.gegc.quotaledger.features.quota.infra.repository.UsageSessionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Each session is closed by its own conditional update, so a session that a normal close
 * finished in the meantime is left alone and nothing is charged twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleSessionReclaimerImpl implements StaleSessionReclaimer {

    private final UsageSessionRepository sessionRepository;
    private final QuotaMetricsService metricsService;
    private final QuotaProperties quotaProperties;
    private final Clock clock;

    @Override
    public List<ReclaimedSessionDto> reclaim(int maxDurationMinutes) {
        if (maxDurationMinutes <= 0) {
            throw new InvalidQuotaRequestException("maxDurationMinutes must be positive: " + maxDurationMinutes);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusMinutes(maxDurationMinutes);

        List<UsageSession> stale = sessionRepository.findByStatusAndStartTimeBefore(UsageSessionStatus.ACTIVE, cutoff);
        List<ReclaimedSessionDto> reclaimed = new ArrayList<>();
        int failed = 0;

        for (UsageSession session : stale) {
            long elapsed = Duration.between(session.getStartTime(), now).toMinutes();
            int duration = (int) Math.min(elapsed, maxDurationMinutes);
            try {
                if (sessionRepository.cleanUpIfActive(session.getId(), now, duration) == 1) {
                    reclaimed.add(new ReclaimedSessionDto(
                            session.getId(), session.getUsername(), session.getResourceType(), duration));
                    QuotaStructuredLogger.logSessionEvent(log, "info",
                            "Reclaimed stale session {} for {}: {} min",
                            session.getUsername(), session.getId(), session.getResourceType(),
                            session.getId(), session.getUsername(), duration);
                }
            } catch (RuntimeException ex) {
                failed++;
                QuotaStructuredLogger.logSessionEvent(log, "error", "Failed to reclaim session {}: {}",
                        session.getUsername(), session.getId(), session.getResourceType(),
                        session.getId(), ex.getMessage(), ex);
            }
        }

        if (!reclaimed.isEmpty()) {
            metricsService.incrementSessionsReclaimed(reclaimed.size());
        }
        if (!stale.isEmpty()) {
            log.info("Stale session sweep: {} candidates, {} reclaimed, {} failed",
                    stale.size(), reclaimed.size(), failed);
        }
        return reclaimed;
    }

    @Override
    public List<ReclaimedSessionDto> reclaim() {
        return reclaim(quotaProperties.getReclaim().getMaxDurationMinutes());
    }
}
