package uk.gegc.quotaledger.features.quota.api.dto;

import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;

import java.time.LocalDateTime;

public record TransactionDto(
        Long id,
        String username,
        long amount,
        QuotaTransactionType transactionType,
        String resourceType,
        Long sessionId,
        String description,
        long balanceBefore,
        long balanceAfter,
        LocalDateTime createdAt,
        String createdBy
) {}
