package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Outcome of a start check. A denial is a normal result, never an exception.
 */
@Schema(name = "QuotaCheckResultDto", description = "Whether a metered start is admitted")
public record QuotaCheckResultDto(
        @Schema(description = "True when the start is admitted")
        boolean allowed,

        @Schema(description = "Human-readable reason, shown to the end user on denial",
                example = "Insufficient quota for 3 min (balance: 25, need: 30, max: 2 min)")
        String message,

        @Schema(description = "minutes * rate; 0 for unlimited accounts", example = "30")
        long estimatedCost,

        @Schema(description = "Balance at the time of the check", example = "25")
        long balance,

        @Schema(description = "Longest affordable run at this rate, present only on a cost denial", example = "2")
        Long maxAffordableMinutes
) {
    public static QuotaCheckResultDto allowed(String message, long estimatedCost, long balance) {
        return new QuotaCheckResultDto(true, message, estimatedCost, balance, null);
    }

    public static QuotaCheckResultDto denied(String message, long estimatedCost, long balance, Long maxAffordableMinutes) {
        return new QuotaCheckResultDto(false, message, estimatedCost, balance, maxAffordableMinutes);
    }
}
