package io.codeforesight.reasoning;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Deadline shared by all reasoning calls of one stage.
 */
public final class TimeBudget {

    private final LongSupplier clockMillis;
    private final long deadlineMillis;

    private TimeBudget(LongSupplier clockMillis, long ttlMillis) {
        this.clockMillis = clockMillis;
        this.deadlineMillis = clockMillis.getAsLong() + ttlMillis;
    }

    public static TimeBudget of(Duration ttl) {
        return of(ttl, System::currentTimeMillis);
    }

    public static TimeBudget of(Duration ttl, LongSupplier clockMillis) {
        return new TimeBudget(clockMillis, ttl.toMillis());
    }

    public static TimeBudget unlimited() {
        return new TimeBudget(() -> 0L, Long.MAX_VALUE / 2);
    }

    public long remainingMillis() {
        return Math.max(0, deadlineMillis - clockMillis.getAsLong());
    }

    public boolean isExhausted() {
        return remainingMillis() == 0;
    }
}
