package uk.gegc.quotaledger.features.quota.domain.exception;

public class UsageSessionNotFoundException extends RuntimeException {
    public UsageSessionNotFoundException(String message) {
        super(message);
    }
}
