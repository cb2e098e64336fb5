package com.phillippitts.council.service.health;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.service.governor.BudgetBalance;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.CostLedger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the daily cost budget.
 *
 * <ul>
 *   <li>UP: spend below the degraded ratio of the daily limit</li>
 *   <li>DEGRADED: spend at or above the degraded ratio (default 80 %)</li>
 *   <li>DOWN: budget exhausted; new queries are refused</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CostBudgetHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Daily budget nearly exhausted");

    private final CostLedger ledger;
    private final CostGovernor governor;
    private final CostGovernorProperties properties;

    public CostBudgetHealthIndicator(CostLedger ledger, CostGovernor governor, CostGovernorProperties properties) {
        this.ledger = ledger;
        this.governor = governor;
        this.properties = properties;
    }

    @Override
    public Health health() {
        BudgetBalance day = ledger.dayBalance();
        double utilisation = day.utilisation();

        Health.Builder builder;
        if (day.remaining() <= 0.0) {
            builder = Health.down().withDetail("status", "Daily budget exhausted");
        } else if (utilisation >= properties.getDegradedRatio()) {
            builder = Health.status(DEGRADED).withDetail("status", "Daily budget above "
                    + Math.round(properties.getDegradedRatio() * 100) + "%");
        } else {
            builder = Health.up().withDetail("status", "Within budget");
        }
        return builder
                .withDetail("spent", round(day.amount()))
                .withDetail("limit", day.limit())
                .withDetail("remaining", round(day.remaining()))
                .withDetail("utilisation", round(utilisation))
                .withDetail("gatewayConfigured", governor.isGatewayConfigured())
                .build();
    }

    private static double round(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
