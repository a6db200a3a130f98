package com.tessera.search.context;

import com.tessera.search.api.exceptions.SearchTimeoutException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Time budget of one search, combined with a cooperative cancellation flag.
 *
 * <p>The ranking pipeline polls {@link #check()} at bucket boundaries. The flag may be
 * raised from any thread with {@link #cancel()}.
 */
public final class Deadline {

    private static final long UNLIMITED = Long.MAX_VALUE;

    private final long startNanos;
    private final long budgetNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private Deadline(long startNanos, long budgetNanos) {
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
    }

    public static Deadline never() {
        return new Deadline(0, UNLIMITED);
    }

    /**
     * A deadline {@code timeout} from now; {@link Duration#ZERO} means no deadline. A
     * negative timeout is already exceeded, and one too long to count in nanoseconds
     * never expires.
     */
    public static Deadline after(Duration timeout) {
        if (timeout.isZero()) {
            return never();
        }
        return new Deadline(System.nanoTime(), budgetNanos(timeout));
    }

    private static long budgetNanos(Duration timeout) {
        if (timeout.isNegative()) {
            return 0;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return UNLIMITED;
        }
    }

    private boolean timeIsUp() {
        return budgetNanos != UNLIMITED && System.nanoTime() - startNanos >= budgetNanos;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExceeded() {
        return cancelled.get() || timeIsUp();
    }

    /**
     * @throws SearchTimeoutException if the deadline passed or the search was cancelled
     */
    public void check() {
        if (cancelled.get()) {
            throw new SearchTimeoutException("The search was cancelled");
        }
        if (timeIsUp()) {
            throw new SearchTimeoutException("The search exceeded its time budget");
        }
    }
}
