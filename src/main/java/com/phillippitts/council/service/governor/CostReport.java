package com.phillippitts.council.service.governor;

import java.util.List;

/**
 * Per-day spend over a trailing window, oldest day first.
 */
public record CostReport(
        List<DailyCost> days,
        double totalCost,
        double averageDailyCost,
        double dailyLimit,
        BudgetBalance today
) {

    public CostReport {
        days = List.copyOf(days);
    }
}
