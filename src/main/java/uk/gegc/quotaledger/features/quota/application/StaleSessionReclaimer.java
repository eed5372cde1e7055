package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.api.dto.ReclaimedSessionDto;

import java.util.List;

/**
 * Closes sessions left active past a safety window (e.g. after a crash) as
 * {@code CLEANED_UP}, without charging for them.
 */
public interface StaleSessionReclaimer {

    List<ReclaimedSessionDto> reclaim(int maxDurationMinutes);

    /**
     * Uses {@code quota.reclaim.max-duration-minutes}.
     */
    List<ReclaimedSessionDto> reclaim();
}
