package uk.gegc.quotaledger.features.quota.api.dto;

import java.util.List;

public record UserQuotaResponse(
        String username,
        long balance,
        boolean unlimited,
        List<TransactionDto> recentTransactions
) {}
