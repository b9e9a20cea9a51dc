package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

import java.time.Duration;

/**
 * No request token became available for a source within the acquire timeout.
 */
public class RateLimitTimeoutException extends CollectionException {

    private final Duration timeout;

    public RateLimitTimeoutException(String sourceName, Duration timeout) {
        super(ErrorKind.RATE_LIMIT_TIMEOUT, sourceName,
                "Rate limit token for " + sourceName + " not available within " + timeout);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
