package uk.gegc.quotaledger.features.quota.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record BatchBalanceEntry(
        @NotBlank
        @Size(max = 200)
        @Pattern(regexp = "^[a-zA-Z0-9._@-]+$")
        String username,

        @NotNull @Min(0) @Max(10_000_000)
        Long amount
) {}
