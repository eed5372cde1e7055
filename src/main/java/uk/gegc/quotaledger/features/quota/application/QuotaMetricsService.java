package uk.gegc.quotaledger.features.quota.application;

public interface QuotaMetricsService {

    void incrementUsageCharged(String resourceType, long amount);

    void incrementSessionStarted(String resourceType);

    void incrementSessionCompleted(String resourceType);

    void incrementSessionsReclaimed(int count);

    void incrementRefreshUpdated(String ruleName, int usersUpdated);

    void incrementGateDenied(String resourceType);
}
