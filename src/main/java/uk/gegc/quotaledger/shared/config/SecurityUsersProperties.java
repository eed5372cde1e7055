package uk.gegc.quotaledger.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Accounts allowed to call the HTTP surface. Passwords use the delegating encoder
 * format, e.g. {@code {bcrypt}$2a$10$...} or {@code {noop}secret} for local runs.
 */
@ConfigurationProperties(prefix = "quota.security")
@Validated
@Data
public class SecurityUsersProperties {

    @Valid
    private List<User> users = new ArrayList<>();

    @Data
    public static class User {
        @NotBlank
        private String username;

        @NotBlank
        private String password;

        /**
         * Grants {@code QUOTA_ADMIN}: balance mutations, list-all, refresh and reclaim.
         */
        private boolean admin;
    }
}
