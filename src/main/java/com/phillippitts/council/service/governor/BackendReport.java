package com.phillippitts.council.service.governor;

import java.util.List;

/**
 * Per-backend spend and reliability over a trailing window, most expensive backend first.
 */
public record BackendReport(int days, List<BackendStats> backends, double totalCost) {

    public BackendReport {
        backends = List.copyOf(backends);
    }
}
