package uk.gegc.quotaledger.features.quota.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable resource-type to cost-per-minute lookup.
 *
 * <p>Unknown resource types fall back to the {@value #DEFAULT_RESOURCE_TYPE} rate, and to
 * {@value #FALLBACK_RATE} when no {@code cpu} rate is configured either. Keys are matched
 * case-insensitively.</p>
 */
public final class RateTable {

    public static final String DEFAULT_RESOURCE_TYPE = "cpu";
    public static final int FALLBACK_RATE = 1;

    private static final RateTable EMPTY = new RateTable(Map.of());

    private final Map<String, Integer> rates;

    private RateTable(Map<String, Integer> rates) {
        this.rates = rates;
    }

    public static RateTable empty() {
        return EMPTY;
    }

    public static RateTable of(Map<String, Integer> rates) {
        if (rates == null || rates.isEmpty()) {
            return EMPTY;
        }
        Map<String, Integer> normalized = new LinkedHashMap<>();
        rates.forEach((key, rate) -> {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Rate table keys must not be blank");
            }
            if (rate == null || rate < 0) {
                throw new IllegalArgumentException("Rate for '" + key + "' must be >= 0, was " + rate);
            }
            normalized.put(key.trim().toLowerCase(Locale.ROOT), rate);
        });
        return new RateTable(Collections.unmodifiableMap(normalized));
    }

    public int rateFor(String resourceType) {
        if (resourceType != null) {
            Integer rate = rates.get(resourceType.trim().toLowerCase(Locale.ROOT));
            if (rate != null) {
                return rate;
            }
        }
        return rates.getOrDefault(DEFAULT_RESOURCE_TYPE, FALLBACK_RATE);
    }

    public Map<String, Integer> asMap() {
        return rates;
    }

    @Override
    public String toString() {
        return "RateTable" + rates;
    }
}
