package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quotaledger.features.quota.api.dto.SessionCloseResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.UsageDeductionResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.UsageSessionDto;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaMetricsService;
import uk.gegc.quotaledger.features.quota.application.QuotaProperties;
import uk.gegc.quotaledger.features.quota.application.QuotaStructuredLogger;
import uk.gegc.quotaledger.features.quota.application.UsageSessionService;
import uk.gegc.quotaledger.features.quota.application.Usernames;
import uk.gegc.quotaledger.features.quota.domain.exception.UsageSessionNotFoundException;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSession;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus;
import uk.gegc.quotaledger.features.quota.infra.mapping.UsageSessionMapper;
import uk.gegc.quotaledger.features.quota.infra.repository.UsageSessionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UsageSessionServiceImpl implements UsageSessionService {

    private final UsageSessionRepository sessionRepository;
    private final QuotaLedgerService ledgerService;
    private final QuotaMetricsService metricsService;
    private final QuotaProperties quotaProperties;
    private final UsageSessionMapper sessionMapper;
    private final Clock clock;

    @Override
    @Transactional
    public long startSession(String username, String resourceType) {
        String normalized = Usernames.normalize(username);
        String type = resourceType == null || resourceType.isBlank()
                ? RateTable.DEFAULT_RESOURCE_TYPE
                : resourceType.trim().toLowerCase(Locale.ROOT);
        LocalDateTime now = LocalDateTime.now(clock);

        UsageSession session = new UsageSession();
        session.setUsername(normalized);
        session.setResourceType(type);
        session.setStartTime(now);
        session.setStatus(UsageSessionStatus.ACTIVE);
        session.setCreatedAt(now);
        UsageSession saved = sessionRepository.save(session);

        metricsService.incrementSessionStarted(type);
        QuotaStructuredLogger.logSessionEvent(log, "info", "Usage session {} started for {} on {}",
                normalized, saved.getId(), type, saved.getId(), normalized, type);
        return saved.getId();
    }

    @Override
    @Transactional
    public SessionCloseResultDto endSession(long sessionId, RateTable rates) {
        Optional<UsageSession> found = sessionRepository.findById(sessionId);
        if (found.isEmpty() || found.get().getStatus() != UsageSessionStatus.ACTIVE) {
            log.debug("Usage session {} is unknown or already closed", sessionId);
            return SessionCloseResultDto.notClosed(sessionId);
        }
        UsageSession session = found.get();
        LocalDateTime now = LocalDateTime.now(clock);

        long elapsed = Duration.between(session.getStartTime(), now).toMinutes();
        int durationMinutes = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, elapsed));
        int rate = (rates != null ? rates : RateTable.empty()).rateFor(session.getResourceType());
        long quotaConsumed = (long) durationMinutes * rate;

        int transitioned = sessionRepository.completeIfActive(sessionId, now, durationMinutes, quotaConsumed);
        if (transitioned == 0) {
            log.debug("Usage session {} was closed concurrently", sessionId);
            return SessionCloseResultDto.notClosed(sessionId);
        }

        if (quotaConsumed > 0) {
            UsageDeductionResultDto deduction = ledgerService.deductForUsage(
                    session.getUsername(), quotaConsumed, session.getResourceType(), sessionId,
                    String.format("Session %d: %d min @ %d/min", sessionId, durationMinutes, rate));
            if (deduction.applied()) {
                metricsService.incrementUsageCharged(session.getResourceType(), deduction.amountCharged());
            }
        }
        metricsService.incrementSessionCompleted(session.getResourceType());

        QuotaStructuredLogger.logSessionEvent(log, "info", "Usage session {} completed: {} min, {} consumed",
                session.getUsername(), sessionId, session.getResourceType(),
                sessionId, durationMinutes, quotaConsumed);
        return new SessionCloseResultDto(sessionId, true, durationMinutes, quotaConsumed);
    }

    @Override
    @Transactional
    public SessionCloseResultDto endSession(long sessionId) {
        return endSession(sessionId, quotaProperties.rateTable());
    }

    @Override
    @Transactional(readOnly = true)
    public UsageSessionDto getSession(long sessionId) {
        return sessionRepository.findById(sessionId)
                .map(sessionMapper::toDto)
                .orElseThrow(() -> new UsageSessionNotFoundException("Usage session " + sessionId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UsageSessionDto> findActiveSession(String username) {
        return sessionRepository
                .findFirstByUsernameAndStatusOrderByStartTimeDesc(Usernames.normalize(username), UsageSessionStatus.ACTIVE)
                .map(sessionMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UsageSessionDto> listActiveSessions() {
        return sessionMapper.toDtos(sessionRepository.findByStatusOrderByStartTimeAsc(UsageSessionStatus.ACTIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public long countActiveSessions() {
        return sessionRepository.countByStatus(UsageSessionStatus.ACTIVE);
    }
}
