package uk.gegc.quotaledger.features.quota.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

@Schema(name = "QuotaModifyRequest", description = "Single-user balance change")
public record QuotaModifyRequest(
        @Schema(description = "set, add, deduct or set_unlimited", example = "add")
        QuotaModifyAction action,

        @Schema(description = "Required for set/add/deduct", example = "100")
        @Min(-10_000_000) @Max(10_000_000)
        Long amount,

        @Schema(description = "Flag for set_unlimited; defaults to true")
        Boolean unlimited,

        @Size(max = 500)
        String description
) {
    public QuotaModifyRequest {
        action = action == null ? QuotaModifyAction.SET : action;
        if (action == QuotaModifyAction.SET_UNLIMITED && unlimited == null) {
            unlimited = Boolean.TRUE;
        }
    }

    @JsonIgnore
    @AssertTrue(message = "amount is required for this action; it cannot be negative for 'set' and must be positive for 'deduct'")
    public boolean isAmountValidForAction() {
        return switch (action) {
            case SET_UNLIMITED -> true;
            case SET -> amount != null && amount >= 0;
            case DEDUCT -> amount != null && amount > 0;
            case ADD -> amount != null;
        };
    }
}
