package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.api.dto.SessionCloseResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.UsageSessionDto;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;

import java.util.List;
import java.util.Optional;

public interface UsageSessionService {

    /**
     * Opens an {@code ACTIVE} session starting now.
     *
     * @return the session id
     */
    long startSession(String username, String resourceType);

    /**
     * Closes the session and charges {@code max(1, elapsed minutes) * rate}. Idempotent: a
     * session that is unknown or no longer active yields {@link SessionCloseResultDto#notClosed}.
     */
    SessionCloseResultDto endSession(long sessionId, RateTable rates);

    SessionCloseResultDto endSession(long sessionId);

    UsageSessionDto getSession(long sessionId);

    Optional<UsageSessionDto> findActiveSession(String username);

    List<UsageSessionDto> listActiveSessions();

    long countActiveSessions();
}
