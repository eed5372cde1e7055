package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.quotaledger.features.quota.domain.model.RefreshAction;

@Schema(name = "RefreshRequest", description = "Bulk add/set over the accounts selected by the targets")
public record RefreshRequest(
        @Schema(description = "Rule name written to each audit row", example = "weekly-topup")
        @Size(max = 100)
        String ruleName,

        @Schema(description = "add or set", example = "add")
        RefreshAction action,

        @Schema(description = "Amount to add (may be negative) or the value to set", example = "10")
        @NotNull @Min(-10_000_000) @Max(10_000_000)
        Long amount,

        @Schema(description = "Cap applied when adding a positive amount")
        @Min(0) @Max(10_000_000)
        Long maxBalance,

        @Schema(description = "Floor applied when adding a negative amount; defaults to 0")
        @Min(0) @Max(10_000_000)
        Long minBalance,

        @Valid
        RefreshTargets targets,

        @Schema(hidden = true)
        String triggeredBy
) {
    public static final String DEFAULT_RULE_NAME = "manual";

    public RefreshRequest {
        ruleName = ruleName == null || ruleName.isBlank() ? DEFAULT_RULE_NAME : ruleName;
        action = action == null ? RefreshAction.ADD : action;
        targets = targets == null ? RefreshTargets.everyone() : targets;
    }

    public static RefreshRequest add(long amount, RefreshTargets targets, String ruleName) {
        return new RefreshRequest(ruleName, RefreshAction.ADD, amount, null, null, targets, null);
    }

    public RefreshRequest withTriggeredBy(String actor) {
        return new RefreshRequest(ruleName, action, amount, maxBalance, minBalance, targets, actor);
    }

    public long effectiveMinBalance() {
        return minBalance == null ? 0L : minBalance;
    }
}
