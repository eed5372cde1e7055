package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;

import java.util.Locale;

public final class Usernames {

    private Usernames() {
    }

    /**
     * Accounts are keyed case-insensitively; every entry point stores and queries the lower-case form.
     */
    public static String normalize(String username) {
        if (username == null || username.isBlank()) {
            throw new InvalidQuotaRequestException("Username must not be blank");
        }
        return username.trim().toLowerCase(Locale.ROOT);
    }
}
