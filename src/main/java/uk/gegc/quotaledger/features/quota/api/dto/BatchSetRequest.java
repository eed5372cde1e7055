package uk.gegc.quotaledger.features.quota.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchSetRequest(
        @NotEmpty
        @Size(max = 1000)
        List<@Valid BatchBalanceEntry> users
) {}
