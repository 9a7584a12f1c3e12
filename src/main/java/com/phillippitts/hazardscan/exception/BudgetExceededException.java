package com.phillippitts.hazardscan.exception;

import java.math.BigDecimal;

/**
 * Thrown when a reservation would push spend past the daily or monthly cap.
 * Tier-scoped: never surfaces to the analysis caller.
 */
public class BudgetExceededException extends HazardScanException {

    private final BigDecimal requested;
    private final BigDecimal remaining;

    public BudgetExceededException(BigDecimal requested, BigDecimal remaining) {
        super("Budget exceeded: requested " + requested.toPlainString()
                + ", remaining " + remaining.toPlainString());
        this.requested = requested;
        this.remaining = remaining;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }
}
