package uk.gegc.quotaledger.features.quota.domain.model;

public enum QuotaTransactionType {
    INITIAL_GRANT,
    ADD,
    DEDUCT,
    SET,
    USAGE,
    SET_UNLIMITED,
    UNSET_UNLIMITED,
    AUTO_REFRESH
}
