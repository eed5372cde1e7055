package uk.gegc.quotaledger.features.quota.api.dto;

public record QuotaModifyResponse(
        String username,
        long balance,
        boolean unlimited,
        QuotaModifyAction action,
        Long amount
) {}
