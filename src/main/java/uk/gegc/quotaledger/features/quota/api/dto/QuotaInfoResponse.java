package uk.gegc.quotaledger.features.quota.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "QuotaInfoResponse", description = "Current metering policy")
public record QuotaInfoResponse(
        @Schema(description = "Whether starts are checked against balances")
        boolean enabled,

        @Schema(description = "Cost per minute by resource type", example = "{\"cpu\": 1, \"gpu\": 10}")
        Map<String, Integer> rates,

        @Schema(description = "Balance a user is expected to hold before starting", example = "10")
        long minimumToStart,

        @Schema(description = "Credit granted when an account is first created", example = "0")
        long defaultGrant
) {}
