package com.phillippitts.hazardscan.service.budget;

import com.phillippitts.hazardscan.domain.BudgetState;

import java.util.Optional;

/**
 * Persistence for budget state. Called under the budget lock after every mutation, so
 * implementations should be fast.
 */
public interface BudgetStore {

    Optional<BudgetState> load();

    void save(BudgetState state);
}
