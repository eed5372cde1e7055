package uk.gegc.quotaledger.features.quota.api.dto;

import uk.gegc.quotaledger.features.quota.domain.model.RefreshAction;

/**
 * @param failed accounts whose update raised an error; they were rolled back individually
 */
public record RefreshResultDto(
        int usersUpdated,
        long totalChange,
        int skipped,
        int failed,
        RefreshAction action,
        String ruleName
) {}
