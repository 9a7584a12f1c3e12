package com.phillippitts.hazardscan.service.budget;

import com.phillippitts.hazardscan.domain.BudgetState;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Process-local store; spend is forgotten on restart. */
public class InMemoryBudgetStore implements BudgetStore {

    private final AtomicReference<BudgetState> state = new AtomicReference<>();

    @Override
    public Optional<BudgetState> load() {
        return Optional.ofNullable(state.get());
    }

    @Override
    public void save(BudgetState newState) {
        state.set(newState);
    }
}
