package io.asyncly.core.execution;

import java.util.concurrent.atomic.AtomicInteger;

/// Bounded budget of concurrently dispatched workers.
///
/// One unit of credit is taken when an alternation point dispatches its right-hand
/// side to a new worker and returned when the driver retires that worker. Credit
/// never goes below zero; a failed {@link #tryAcquire()} makes the alternation run
/// inline instead.
///
/// @implNote **Thread-safe**. Acquisition is a CAS loop on an {@link AtomicInteger}
/// counting outstanding workers.
public final class CreditPool {

    private static final int UNLIMITED = -1;

    private final int limit;
    private final AtomicInteger outstanding = new AtomicInteger();

    private CreditPool(int limit) {
        this.limit = limit;
    }

    /// Creates a pool allowing at most `limit` outstanding workers.
    ///
    /// @param limit maximum outstanding workers, 0 for fully inline execution
    /// @throws IllegalArgumentException if limit is negative
    public static CreditPool of(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Thread credit must not be negative: " + limit);
        }
        return new CreditPool(limit);
    }

    /// Creates a pool that never refuses credit.
    public static CreditPool unlimited() {
        return new CreditPool(UNLIMITED);
    }

    /// Takes one unit of credit if any is available.
    ///
    /// @return true if a worker may be dispatched
    public boolean tryAcquire() {
        if (limit == UNLIMITED) {
            outstanding.incrementAndGet();
            return true;
        }
        while (true) {
            int current = outstanding.get();
            if (current >= limit) {
                return false;
            }
            if (outstanding.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /// Returns one unit of credit taken by {@link #tryAcquire()}.
    ///
    /// @throws IllegalStateException if no credit is outstanding
    public void release() {
        while (true) {
            int current = outstanding.get();
            if (current == 0) {
                throw new IllegalStateException("Credit released without a matching acquire");
            }
            if (outstanding.compareAndSet(current, current - 1)) {
                return;
            }
        }
    }

    public boolean isUnlimited() {
        return limit == UNLIMITED;
    }

    /// Credit currently available, {@link Integer#MAX_VALUE} for an unlimited pool.
    public int available() {
        return limit == UNLIMITED ? Integer.MAX_VALUE : limit - outstanding.get();
    }

    /// Number of dispatched workers not yet retired.
    public int outstanding() {
        return outstanding.get();
    }

    @Override
    public String toString() {
        return limit == UNLIMITED
                ? "CreditPool{unlimited, outstanding=" + outstanding.get() + "}"
                : "CreditPool{limit=" + limit + ", outstanding=" + outstanding.get() + "}";
    }
}
