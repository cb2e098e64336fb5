package com.phillippitts.council.service.health;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.domain.BudgetScope;
import com.phillippitts.council.service.governor.BudgetBalance;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.CostLedger;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CostBudgetHealthIndicatorTest {

    private final CostLedger ledger = mock(CostLedger.class);
    private final CostGovernor governor = mock(CostGovernor.class);
    private final CostGovernorProperties properties = new CostGovernorProperties(10.0, 1.0);

    @Test
    void shouldReportUpWithinBudget() {
        when(ledger.dayBalance()).thenReturn(new BudgetBalance(BudgetScope.DAY, 2.5, 10.0, 7.5));
        when(governor.isGatewayConfigured()).thenReturn(true);

        Health health = new CostBudgetHealthIndicator(ledger, governor, properties).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("spent", 2.5)
                .containsEntry("remaining", 7.5)
                .containsEntry("utilisation", 0.25)
                .containsEntry("gatewayConfigured", true);
    }

    @Test
    void shouldReportDegradedAboveRatio() {
        when(ledger.dayBalance()).thenReturn(new BudgetBalance(BudgetScope.DAY, 8.5, 10.0, 1.5));

        Health health = new CostBudgetHealthIndicator(ledger, governor, properties).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Daily budget above 80%");
    }

    @Test
    void shouldReportDownWhenExhausted() {
        when(ledger.dayBalance()).thenReturn(new BudgetBalance(BudgetScope.DAY, 10.2, 10.0, 0.0));

        Health health = new CostBudgetHealthIndicator(ledger, governor, properties).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Daily budget exhausted")
                .containsEntry("gatewayConfigured", false);
    }
}
