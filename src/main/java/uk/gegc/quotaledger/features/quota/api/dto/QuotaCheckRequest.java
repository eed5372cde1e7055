package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "QuotaCheckRequest", description = "Start check issued by a workload supervisor")
public record QuotaCheckRequest(
        @Schema(description = "User who wants to start", example = "alice")
        @NotBlank @Pattern(regexp = "^[a-zA-Z0-9._@-]+$") @Size(max = 200)
        String username,

        @Schema(description = "Resource type priced by the rate table", example = "gpu")
        @Size(max = 100)
        String resourceType,

        @Schema(description = "Requested runtime in minutes", example = "60")
        @Min(0) @Max(525_600)
        int minutes
) {}
