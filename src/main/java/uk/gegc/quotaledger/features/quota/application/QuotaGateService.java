package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.api.dto.QuotaCheckResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaInfoResponse;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;

/**
 * Read-only admission check run before metered work starts. Nothing is deducted here; the
 * charge happens when the usage session closes.
 */
public interface QuotaGateService {

    QuotaCheckResultDto canStart(String username, String resourceType, int minutes,
                                 RateTable rates, long defaultGrant);

    /**
     * Uses the currently configured rates and default grant. Admits everything while quota
     * enforcement is disabled.
     */
    QuotaCheckResultDto canStart(String username, String resourceType, int minutes);

    QuotaInfoResponse describePolicy();
}
