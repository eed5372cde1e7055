package uk.gegc.quotaledger.features.quota.domain.exception;

public class InsufficientQuotaException extends RuntimeException {

    private final long availableBalance;
    private final long requestedAmount;

    public InsufficientQuotaException(String message, long availableBalance, long requestedAmount) {
        super(message);
        this.availableBalance = availableBalance;
        this.requestedAmount = requestedAmount;
    }

    public long getAvailableBalance() {
        return availableBalance;
    }

    public long getRequestedAmount() {
        return requestedAmount;
    }

    public long getShortfall() {
        return Math.max(0, requestedAmount - availableBalance);
    }
}
