package uk.gegc.quotaledger.features.quota.api.dto;

/**
 * @param applied       true when a usage transaction was written
 * @param amountCharged amount actually taken from the balance after clamping at zero
 * @param newBalance    balance after the deduction
 */
public record UsageDeductionResultDto(
        boolean applied,
        long amountCharged,
        long newBalance
) {}
