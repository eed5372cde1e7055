package uk.gegc.quotaledger.features.quota.domain.model;

public enum UsageSessionStatus {
    ACTIVE,
    COMPLETED,
    CLEANED_UP
}
