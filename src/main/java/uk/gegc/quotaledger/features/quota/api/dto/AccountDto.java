package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "AccountDto", description = "Quota account of one user")
public record AccountDto(
        @Schema(description = "Lower-case username", example = "alice")
        String username,

        @Schema(description = "Remaining credit units", example = "120")
        long balance,

        @Schema(description = "When true the quota gate always approves and usage is not charged")
        boolean unlimited,

        @Schema(description = "Last balance mutation timestamp")
        LocalDateTime updatedAt
) {}
