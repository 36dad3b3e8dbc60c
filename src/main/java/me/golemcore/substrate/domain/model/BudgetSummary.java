package me.golemcore.substrate.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only view over all budget accounts.
 */
@Value
@Builder
public class BudgetSummary {

    List<BudgetAccount> accounts;
    long totalAllocated;
    long totalConsumed;

    public long getTotalRemaining() {
        return totalAllocated - totalConsumed;
    }
}
