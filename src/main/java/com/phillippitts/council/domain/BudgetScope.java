package com.phillippitts.council.domain;

/**
 * Budget a priced call is checked against.
 */
public enum BudgetScope {
    QUERY,
    DAY
}
