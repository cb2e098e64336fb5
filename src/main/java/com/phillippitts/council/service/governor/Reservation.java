package com.phillippitts.council.service.governor;

/**
 * Estimated spend held against the budgets while a call is in flight.
 */
public record Reservation(long id, String queryId, double amount) {
}
