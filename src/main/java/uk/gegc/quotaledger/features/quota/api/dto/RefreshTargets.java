package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import uk.gegc.quotaledger.shared.validation.ValidRegex;

import java.util.List;

/**
 * Filters selecting the accounts a refresh touches. All present clauses are AND-ed.
 */
@Schema(name = "RefreshTargets", description = "Targeting predicate for a batch refresh")
public record RefreshTargets(
        @Schema(description = "Also touch unlimited accounts")
        boolean includeUnlimited,

        @Schema(description = "Only accounts with balance < this value")
        @Min(0) @Max(10_000_000)
        Long balanceBelow,

        @Schema(description = "Only accounts with balance > this value")
        @Min(-10_000_000) @Max(10_000_000)
        Long balanceAbove,

        @Schema(description = "Allow-list of usernames (case-insensitive)")
        @Size(max = 1000)
        List<@Pattern(regexp = "^[a-zA-Z0-9._@-]{1,200}$") String> includeUsers,

        @Schema(description = "Deny-list of usernames (case-insensitive)")
        @Size(max = 1000)
        List<@Pattern(regexp = "^[a-zA-Z0-9._@-]{1,200}$") String> excludeUsers,

        @Schema(description = "Regular expression matched case-insensitively from the start of the username")
        @Size(max = 500)
        @ValidRegex
        String usernamePattern
) {
    public RefreshTargets {
        includeUsers = includeUsers == null ? List.of() : List.copyOf(includeUsers);
        excludeUsers = excludeUsers == null ? List.of() : List.copyOf(excludeUsers);
    }

    public static RefreshTargets everyone() {
        return new RefreshTargets(false, null, null, List.of(), List.of(), null);
    }
}
