package uk.gegc.quotaledger.features.quota.api.dto;

import uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus;

import java.time.LocalDateTime;

public record UsageSessionDto(
        Long id,
        String username,
        String resourceType,
        LocalDateTime startTime,
        LocalDateTime endTime,
        Integer durationMinutes,
        Long quotaConsumed,
        UsageSessionStatus status
) {}
