package com.phillippitts.council.service.governor;

import java.time.LocalDate;

/**
 * Totals of one day in the reset zone.
 */
public record DailyCost(LocalDate date, double totalCost, int calls, int failedCalls) {
}
