package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.api.dto.RefreshTargets;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiled form of {@link RefreshTargets}. Clauses are AND-ed; an absent clause matches everyone.
 *
 * <p>The username pattern is anchored at the start of the name only ({@code lookingAt}) and
 * is case-insensitive. A pattern that does not compile matches no account at all.</p>
 */
public final class RefreshTargetMatcher {

    private final boolean includeUnlimited;
    private final Long balanceBelow;
    private final Long balanceAbove;
    private final Set<String> includeUsers;
    private final Set<String> excludeUsers;
    private final Pattern usernamePattern;
    private final boolean invalidPattern;

    private RefreshTargetMatcher(RefreshTargets targets) {
        this.includeUnlimited = targets.includeUnlimited();
        this.balanceBelow = targets.balanceBelow();
        this.balanceAbove = targets.balanceAbove();
        this.includeUsers = normalize(targets.includeUsers().stream().collect(Collectors.toSet()));
        this.excludeUsers = normalize(targets.excludeUsers().stream().collect(Collectors.toSet()));

        Pattern compiled = null;
        boolean invalid = false;
        String raw = targets.usernamePattern();
        if (raw != null && !raw.isEmpty()) {
            try {
                compiled = Pattern.compile(raw, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException ex) {
                invalid = true;
            }
        }
        this.usernamePattern = compiled;
        this.invalidPattern = invalid;
    }

    public static RefreshTargetMatcher compile(RefreshTargets targets) {
        return new RefreshTargetMatcher(targets == null ? RefreshTargets.everyone() : targets);
    }

    public boolean hasInvalidPattern() {
        return invalidPattern;
    }

    public boolean matches(QuotaAccount account) {
        if (invalidPattern) {
            return false;
        }
        if (account.isUnlimited() && !includeUnlimited) {
            return false;
        }
        String username = account.getUsername().toLowerCase(Locale.ROOT);
        if (!includeUsers.isEmpty() && !includeUsers.contains(username)) {
            return false;
        }
        if (excludeUsers.contains(username)) {
            return false;
        }
        if (balanceBelow != null && account.getBalance() >= balanceBelow) {
            return false;
        }
        if (balanceAbove != null && account.getBalance() <= balanceAbove) {
            return false;
        }
        return usernamePattern == null || usernamePattern.matcher(username).lookingAt();
    }

    private static Set<String> normalize(Set<String> usernames) {
        return usernames.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
