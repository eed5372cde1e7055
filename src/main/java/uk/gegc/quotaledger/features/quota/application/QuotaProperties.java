package uk.gegc.quotaledger.features.quota.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshTargets;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;
import uk.gegc.quotaledger.features.quota.domain.model.RefreshAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metering policy (rates, default grant) and sweep settings.
 *
 * <p>The engine asks for {@link #rateTable()} on every call instead of caching it, so a
 * refreshed configuration applies to the next check or close.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "quota")
@Validated
@Data
public class QuotaProperties {

    /**
     * When false every start check is admitted without consulting balances.
     */
    private boolean enabled = true;

    /**
     * Cost per minute for the {@code cpu} resource type, which is also the fallback rate.
     */
    @PositiveOrZero
    private int cpuRate = 1;

    /**
     * Cost per minute per accelerator/resource type, e.g. {@code quota.rates.gpu=10}.
     */
    private Map<String, Integer> rates = new LinkedHashMap<>();

    /**
     * Credit granted the first time an account is referenced by a start check.
     */
    @PositiveOrZero
    private long defaultGrant = 0L;

    /**
     * Advertised to clients as the balance they should hold before starting.
     */
    @PositiveOrZero
    private long minimumToStart = 10L;

    @Valid
    private Reclaim reclaim = new Reclaim();

    @Valid
    private Refresh refresh = new Refresh();

    public RateTable rateTable() {
        Map<String, Integer> merged = new LinkedHashMap<>();
        merged.put(RateTable.DEFAULT_RESOURCE_TYPE, cpuRate);
        if (rates != null) {
            merged.putAll(rates);
        }
        return RateTable.of(merged);
    }

    @Data
    public static class Reclaim {
        private boolean enabled = true;

        /**
         * Run one sweep as soon as the application is ready.
         */
        private boolean onStartup = true;

        /**
         * Sessions active for longer than this are closed without charge.
         */
        @Positive
        private int maxDurationMinutes = 480;

        @Positive
        private long fixedDelayMs = 900_000L;
    }

    @Data
    public static class Refresh {
        @Valid
        private List<Rule> rules = new ArrayList<>();
    }

    @Data
    public static class Rule {
        @NotBlank
        private String name;

        /**
         * Spring cron expression, e.g. {@code 0 0 3 * * MON}.
         */
        @NotBlank
        private String cron;

        @NotNull
        private RefreshAction action = RefreshAction.ADD;

        private long amount;

        private Long maxBalance;

        private Long minBalance;

        private boolean includeUnlimited;

        private Long balanceBelow;

        private Long balanceAbove;

        private List<String> includeUsers = new ArrayList<>();

        private List<String> excludeUsers = new ArrayList<>();

        private String usernamePattern;

        public RefreshTargets targets() {
            return new RefreshTargets(includeUnlimited, balanceBelow, balanceAbove,
                    includeUsers, excludeUsers, usernamePattern);
        }
    }
}
