package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "StartSessionRequest", description = "Opens a metered usage session")
public record StartSessionRequest(
        @NotBlank @Pattern(regexp = "^[a-zA-Z0-9._@-]+$") @Size(max = 200)
        String username,

        @Schema(description = "Defaults to cpu", example = "gpu")
        @Size(max = 100)
        String resourceType
) {}
