package uk.gegc.quotaledger.features.quota.domain.exception;

public class InvalidQuotaRequestException extends RuntimeException {
    public InvalidQuotaRequestException(String message) {
        super(message);
    }
}
