package com.phillippitts.hazardscan.service.budget;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Handle for an amount held against the budget caps until it is committed or released.
 *
 * @param id unique per budget manager
 * @param amount reserved maximum charge
 */
public record Reservation(long id, BigDecimal amount) {
    public Reservation {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
    }
}
