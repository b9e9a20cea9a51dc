package com.openrangelabs.blacklist.collector.scheduler;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

import java.time.Duration;

/**
 * Exponential retry delay after failed runs: {@code min(base * 2^(n-1), cap)}
 * for the n-th consecutive failure, where the base is the source's own interval.
 */
public class BackoffPolicy {

    /**
     * Delay before retrying after {@code consecutiveFailures} failures in a row.
     */
    public Duration delayFor(int consecutiveFailures, Duration base, Duration cap) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        int exponent = consecutiveFailures - 1;
        if (exponent >= 30) {
            return cap;
        }
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    /**
     * Delay after a failure of the given kind. Failures that retrying cannot fix
     * wait the cap, and never less than the regular interval.
     */
    public Duration delayAfter(ErrorKind errorKind, int consecutiveFailures, Duration base, Duration cap) {
        if (errorKind != null && errorKind.requiresOperator()) {
            return base.compareTo(cap) > 0 ? base : cap;
        }
        return delayFor(consecutiveFailures, base, cap);
    }
}
