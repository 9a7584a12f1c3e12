package com.phillippitts.hazardscan.service.budget;

import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.exception.BudgetExceededException;
import com.phillippitts.hazardscan.service.orchestration.event.BudgetStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks cloud spend against daily and monthly caps.
 *
 * <p>Spend is reserved before a billable call and settled afterwards:
 * <ul>
 *   <li>{@link #checkAndReserve(BigDecimal)} holds the declared cost; the cap check and the
 *       hold happen atomically, and held amounts count against both caps</li>
 *   <li>{@link #commit(Reservation, BigDecimal)} charges the metered cost, clamped to the held
 *       amount, so a completed reservation can never push spend past a cap</li>
 *   <li>{@link #release(Reservation)} refunds the hold</li>
 * </ul>
 * Commit and release are idempotent per reservation: only the first settlement counts.
 *
 * <p>Daily spend resets when the calendar day changes in the configured zone; monthly spend
 * (and daily) when the calendar month changes. State is written to the {@link BudgetStore} and
 * a {@link BudgetStateChangedEvent} is published after every mutation.
 */
public class BudgetManager {
    private static final Logger LOG = LogManager.getLogger(BudgetManager.class);

    private final Object lock = new Object();
    private final Clock clock;
    private final ZoneId zone;
    private final BudgetStore store;
    private final ApplicationEventPublisher publisher;
    private final Map<Long, BigDecimal> open = new HashMap<>();

    private BudgetState state;
    private long nextReservationId = 1;

    public BudgetManager(BigDecimal dailyCap, BigDecimal monthlyCap, ZoneId zone, Clock clock,
                         BudgetStore store, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(dailyCap, "dailyCap");
        Objects.requireNonNull(monthlyCap, "monthlyCap");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = publisher;

        // Configured caps win over persisted ones; reservations never survive a restart
        this.state = store.load()
                .map(s -> new BudgetState(s.dailySpend(), s.monthlySpend(), BigDecimal.ZERO,
                        dailyCap, monthlyCap, s.lastReset()))
                .orElseGet(() -> BudgetState.empty(dailyCap, monthlyCap, clock.instant()));
        store.save(state);
    }

    /**
     * Holds {@code cost} against the caps.
     *
     * @throws BudgetExceededException if the hold would exceed the daily or monthly cap
     */
    public Reservation checkAndReserve(BigDecimal cost) {
        Objects.requireNonNull(cost, "cost");
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("cost must be >= 0, got: " + cost);
        }
        Reservation reservation;
        BudgetState snapshot;
        synchronized (lock) {
            rolloverIfNeeded();
            if (!state.canAfford(cost)) {
                BigDecimal remaining = state.remainingDaily().min(state.remainingMonthly());
                LOG.info("Budget reservation of {} denied (remaining {})", cost.toPlainString(), remaining.toPlainString());
                throw new BudgetExceededException(cost, remaining);
            }
            reservation = new Reservation(nextReservationId++, cost);
            open.put(reservation.id(), cost);
            state = withReserved(state, state.reserved().add(cost));
            snapshot = persist();
        }
        publish(snapshot, "reserve");
        return reservation;
    }

    /**
     * Settles a reservation by charging {@code actualCost}, clamped to [0, reserved amount].
     * A {@code null} actual cost charges the full reserved amount. No-op if already settled.
     */
    public void commit(Reservation reservation, BigDecimal actualCost) {
        Objects.requireNonNull(reservation, "reservation");
        BudgetState snapshot;
        synchronized (lock) {
            BigDecimal held = open.remove(reservation.id());
            if (held == null) {
                return;
            }
            rolloverIfNeeded();
            BigDecimal charge = actualCost == null ? held : actualCost.max(BigDecimal.ZERO).min(held);
            if (actualCost != null && actualCost.compareTo(held) > 0) {
                LOG.warn("Metered cost {} exceeds reserved {}; charging reserved amount",
                        actualCost.toPlainString(), held.toPlainString());
            }
            state = new BudgetState(
                    state.dailySpend().add(charge),
                    state.monthlySpend().add(charge),
                    state.reserved().subtract(held).max(BigDecimal.ZERO),
                    state.dailyCap(),
                    state.monthlyCap(),
                    state.lastReset());
            snapshot = persist();
        }
        publish(snapshot, "commit");
    }

    /** Refunds a reservation. No-op if already settled. */
    public void release(Reservation reservation) {
        Objects.requireNonNull(reservation, "reservation");
        BudgetState snapshot;
        synchronized (lock) {
            BigDecimal held = open.remove(reservation.id());
            if (held == null) {
                return;
            }
            rolloverIfNeeded();
            state = withReserved(state, state.reserved().subtract(held).max(BigDecimal.ZERO));
            snapshot = persist();
        }
        publish(snapshot, "release");
    }

    public BudgetState currentState() {
        BudgetState snapshot;
        boolean rolled;
        synchronized (lock) {
            rolled = rolloverIfNeeded();
            snapshot = rolled ? persist() : state;
        }
        if (rolled) {
            publish(snapshot, "rollover");
        }
        return snapshot;
    }

    /** Number of reservations not yet committed or released. */
    public int openReservations() {
        synchronized (lock) {
            return open.size();
        }
    }

    private boolean rolloverIfNeeded() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, zone);
        LocalDate last = LocalDate.ofInstant(state.lastReset(), zone);
        if (!today.isAfter(last)) {
            return false;
        }
        boolean newMonth = today.getYear() != last.getYear() || today.getMonth() != last.getMonth();
        state = new BudgetState(
                BigDecimal.ZERO,
                newMonth ? BigDecimal.ZERO : state.monthlySpend(),
                state.reserved(),
                state.dailyCap(),
                state.monthlyCap(),
                now);
        LOG.info("Budget {} rollover at {}", newMonth ? "monthly" : "daily", today);
        return true;
    }

    private static BudgetState withReserved(BudgetState s, BigDecimal reserved) {
        return new BudgetState(s.dailySpend(), s.monthlySpend(), reserved, s.dailyCap(), s.monthlyCap(),
                s.lastReset());
    }

    private BudgetState persist() {
        store.save(state);
        return state;
    }

    private void publish(BudgetState snapshot, String change) {
        if (publisher != null) {
            publisher.publishEvent(new BudgetStateChangedEvent(snapshot, change, null));
        }
    }
}
