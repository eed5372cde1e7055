package uk.gegc.quotaledger.features.quota.api.dto;

/**
 * Result of closing a usage session. {@code closed == false} (with zero duration and cost)
 * means the session was unknown or already closed by someone else.
 */
public record SessionCloseResultDto(
        Long sessionId,
        boolean closed,
        int durationMinutes,
        long quotaConsumed
) {
    public static SessionCloseResultDto notClosed(Long sessionId) {
        return new SessionCloseResultDto(sessionId, false, 0, 0L);
    }
}
