package com.phillippitts.council.exception;

import com.phillippitts.council.domain.BudgetScope;

/**
 * Thrown before dispatch when a priced call would push spend past a budget limit.
 * No cost has been incurred when this is raised.
 */
public class AdmissionDeniedException extends CouncilException {

    private final BudgetScope scope;
    private final double spent;
    private final double estimate;
    private final double limit;

    public AdmissionDeniedException(BudgetScope scope, double spent, double estimate, double limit) {
        super(String.format("%s budget exceeded: spent=%.4f, estimate=%.4f, limit=%.2f",
                scope, spent, estimate, limit));
        this.scope = scope;
        this.spent = spent;
        this.estimate = estimate;
        this.limit = limit;
    }

    public BudgetScope getScope() {
        return scope;
    }

    public double getSpent() {
        return spent;
    }

    public double getEstimate() {
        return estimate;
    }

    public double getLimit() {
        return limit;
    }
}
