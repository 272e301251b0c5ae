package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.exception.QueryTimeoutException;

/**
 * Cooperative time budget for one query. Engines call {@link #check()} inside their loops;
 * the clock is only read every {@value #CHECK_INTERVAL} calls. Not thread-safe: one instance per query.
 */
public final class QueryDeadline {
    static final int CHECK_INTERVAL = 256;
    // keeps the nanoTime() difference in check() representable; about 146 years
    private static final long MAX_BUDGET_NANOS = Long.MAX_VALUE / 2;
    private static final long MAX_BUDGET_MILLIS = MAX_BUDGET_NANOS / 1_000_000L;

    private static final QueryDeadline NONE = new QueryDeadline(0, Long.MAX_VALUE);

    private final long budgetMillis;
    private final long deadlineNanos;
    private int ticks;

    private QueryDeadline(long budgetMillis, long deadlineNanos) {
        this.budgetMillis = budgetMillis;
        this.deadlineNanos = deadlineNanos;
    }

    public static QueryDeadline none() {
        return NONE;
    }

    /** A budget of zero or less means no budget. */
    public static QueryDeadline ofMillis(long budgetMillis) {
        if (budgetMillis <= 0) {
            return NONE;
        }
        long budgetNanos = budgetMillis > MAX_BUDGET_MILLIS ? MAX_BUDGET_NANOS : budgetMillis * 1_000_000L;
        return new QueryDeadline(budgetMillis, System.nanoTime() + budgetNanos);
    }

    public boolean isUnlimited() {
        return this == NONE;
    }

    public void check() {
        if (this == NONE) {
            return;
        }
        if (++ticks % CHECK_INTERVAL == 0 && System.nanoTime() - deadlineNanos > 0) {
            throw new QueryTimeoutException(budgetMillis);
        }
    }
}
