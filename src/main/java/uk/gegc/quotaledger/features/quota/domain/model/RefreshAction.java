package uk.gegc.quotaledger.features.quota.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;

import java.util.Locale;

public enum RefreshAction {
    ADD("add"),
    SET("set");

    private final String value;

    RefreshAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RefreshAction fromValue(String value) {
        if (value == null) {
            throw new InvalidQuotaRequestException("Refresh action is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RefreshAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        throw new InvalidQuotaRequestException("Invalid action: " + value);
    }
}
