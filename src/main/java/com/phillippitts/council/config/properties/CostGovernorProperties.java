package com.phillippitts.council.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Typed properties for the cost governor: budgets, daily reset boundary and response cache.
 */
@Validated
@ConfigurationProperties(prefix = "council.governor")
public class CostGovernorProperties {

    /** Maximum spend (USD) across all queries per day. */
    @Positive
    private final double dailyLimit;

    /** Maximum spend (USD) of a single query. */
    @Positive
    private final double queryLimit;

    /** Zone whose midnight resets the daily budget. */
    private final ZoneId resetZone;

    private final boolean cacheEnabled;

    private final Duration cacheTtl;

    @Min(1)
    private final int cacheCapacity;

    /** Fraction of the daily budget above which health reports DEGRADED. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double degradedRatio;

    /** Days of ledger history kept in memory for cost reports. */
    @Min(1)
    private final int ledgerRetentionDays;

    /** Multiplier applied to the admission estimate. */
    @DecimalMin("1.0")
    private final double estimateSafetyFactor;

    /** Response cache backing: {@code memory} or {@code redis}. */
    @Pattern(regexp = "memory|redis")
    private final String cacheStore;

    @ConstructorBinding
    public CostGovernorProperties(Double dailyLimit,
                                  Double queryLimit,
                                  String resetZone,
                                  Boolean cacheEnabled,
                                  Duration cacheTtl,
                                  Integer cacheCapacity,
                                  Double degradedRatio,
                                  Integer ledgerRetentionDays,
                                  Double estimateSafetyFactor,
                                  String cacheStore) {
        this.dailyLimit = dailyLimit == null ? 100.0 : dailyLimit;
        this.queryLimit = queryLimit == null ? 5.0 : queryLimit;
        this.resetZone = resetZone == null || resetZone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(resetZone);
        this.cacheEnabled = cacheEnabled == null || cacheEnabled;
        this.cacheTtl = cacheTtl == null ? Duration.ofHours(1) : cacheTtl;
        this.cacheCapacity = cacheCapacity == null ? 1000 : cacheCapacity;
        this.degradedRatio = degradedRatio == null ? 0.8 : degradedRatio;
        this.ledgerRetentionDays = ledgerRetentionDays == null ? 31 : ledgerRetentionDays;
        this.estimateSafetyFactor = estimateSafetyFactor == null ? 1.0 : estimateSafetyFactor;
        this.cacheStore = cacheStore == null || cacheStore.isBlank() ? "memory" : cacheStore;
    }

    /**
     * Test convenience: defaults with the given limits.
     */
    public CostGovernorProperties(double dailyLimit, double queryLimit) {
        this(dailyLimit, queryLimit, null, null, null, null, null, null, null, null);
    }

    public double getDailyLimit() {
        return dailyLimit;
    }

    public double getQueryLimit() {
        return queryLimit;
    }

    public ZoneId getResetZone() {
        return resetZone;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public double getDegradedRatio() {
        return degradedRatio;
    }

    public int getLedgerRetentionDays() {
        return ledgerRetentionDays;
    }

    public double getEstimateSafetyFactor() {
        return estimateSafetyFactor;
    }

    public String getCacheStore() {
        return cacheStore;
    }
}
