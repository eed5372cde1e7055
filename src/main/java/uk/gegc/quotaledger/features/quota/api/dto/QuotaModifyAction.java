package uk.gegc.quotaledger.features.quota.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;

import java.util.Locale;

public enum QuotaModifyAction {
    SET("set"),
    ADD("add"),
    DEDUCT("deduct"),
    SET_UNLIMITED("set_unlimited");

    private final String value;

    QuotaModifyAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static QuotaModifyAction fromValue(String value) {
        if (value == null) {
            return SET;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuotaModifyAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        throw new InvalidQuotaRequestException("Invalid action: " + value);
    }
}
