package uk.gegc.quotaledger.features.quota.api.dto;

public record ReclaimedSessionDto(
        Long sessionId,
        String username,
        String resourceType,
        int durationMinutes
) {}
