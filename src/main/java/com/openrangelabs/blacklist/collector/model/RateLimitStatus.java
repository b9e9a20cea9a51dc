package com.openrangelabs.blacklist.collector.model;

/**
 * Token bucket snapshot for an outbound source.
 */
public class RateLimitStatus {

    private final int capacity;
    private final double availableTokens;
    private final double refillPerSecond;
    private final double configuredRefillPerSecond;
    private final long granted;
    private final long timedOut;

    public RateLimitStatus(int capacity, double availableTokens, double refillPerSecond,
                           double configuredRefillPerSecond, long granted, long timedOut) {
        this.capacity = capacity;
        this.availableTokens = availableTokens;
        this.refillPerSecond = refillPerSecond;
        this.configuredRefillPerSecond = configuredRefillPerSecond;
        this.granted = granted;
        this.timedOut = timedOut;
    }

    public boolean isNearLimit(double threshold) {
        return availableTokens / capacity <= threshold;
    }

    public boolean isExhausted() {
        return availableTokens < 1.0;
    }

    /**
     * Whether the source slowed the limiter below its configured rate.
     */
    public boolean isThrottled() {
        return refillPerSecond < configuredRefillPerSecond;
    }

    // Getters
    public int getCapacity() { return capacity; }
    public double getAvailableTokens() { return availableTokens; }
    public double getRefillPerSecond() { return refillPerSecond; }
    public double getConfiguredRefillPerSecond() { return configuredRefillPerSecond; }
    public long getGranted() { return granted; }
    public long getTimedOut() { return timedOut; }

    @Override
    public String toString() {
        return "RateLimitStatus{" +
                "capacity=" + capacity +
                ", availableTokens=" + String.format("%.2f", availableTokens) +
                ", refillPerSecond=" + refillPerSecond +
                ", configuredRefillPerSecond=" + configuredRefillPerSecond +
                ", granted=" + granted +
                ", timedOut=" + timedOut +
                '}';
    }
}
