package com.phillippitts.council.service.governor;

import com.phillippitts.council.domain.BudgetScope;

/**
 * Spend against one budget at a point in time.
 *
 * @param scope     query or day
 * @param amount    spend so far, including in-flight reservations
 * @param limit     configured limit
 * @param remaining {@code limit - amount}; negative when a call cost more than it reserved
 */
public record BudgetBalance(BudgetScope scope, double amount, double limit, double remaining) {

    static BudgetBalance of(BudgetScope scope, double amount, double limit) {
        return new BudgetBalance(scope, amount, limit, limit - amount);
    }

    public double utilisation() {
        return limit <= 0.0 ? 1.0 : amount / limit;
    }
}
