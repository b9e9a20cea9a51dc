package com.openrangelabs.blacklist.collector.ratelimit;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.exception.RateLimitTimeoutException;
import com.openrangelabs.blacklist.collector.model.RateLimitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-source token bucket limiter for outbound portal requests.
 * Waiting suspends only the calling pipeline, never a thread. Sources that answer
 * with 429 or 503 are slowed down until they accept requests again.
 */
@Component
public class SourceRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SourceRateLimiter.class);

    private final CollectorProperties properties;
    private final LongSupplier nanoTime;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public SourceRateLimiter(CollectorProperties properties) {
        this(properties, System::nanoTime);
    }

    SourceRateLimiter(CollectorProperties properties, LongSupplier nanoTime) {
        this.properties = properties;
        this.nanoTime = nanoTime;
    }

    /**
     * Completes once a token for the source has been granted.
     * Fails with {@link RateLimitTimeoutException} when the wait would exceed the configured timeout.
     */
    public Mono<Void> acquire(String sourceName) {
        return Mono.defer(() -> {
            Duration timeout = properties.rateLimitFor(sourceName).getAcquireTimeout();
            Duration wait = bucketFor(sourceName).reserve(timeout);
            if (wait == null) {
                logger.warn("Rate limit timeout for source {} after {}", sourceName, timeout);
                return Mono.error(new RateLimitTimeoutException(sourceName, timeout));
            }
            if (wait.isZero()) {
                return Mono.empty();
            }
            logger.debug("Rate limit for {} delays request by {} ms", sourceName, wait.toMillis());
            return Mono.delay(wait).then();
        });
    }

    /**
     * Takes a token without waiting.
     */
    public boolean tryAcquire(String sourceName) {
        return bucketFor(sourceName).tryAcquire();
    }

    /**
     * Slows the source down after it answered with an overload status.
     */
    public void onThrottled(String sourceName, int statusCode) {
        double rate = bucketFor(sourceName).slowDown();
        logger.warn("Source {} answered HTTP {}, request rate lowered to {}/s",
                sourceName, statusCode, String.format("%.2f", rate));
    }

    /**
     * Records a request the source accepted.
     */
    public void onSuccess(String sourceName) {
        bucketFor(sourceName).recordSuccess();
    }

    public RateLimitStatus getStatus(String sourceName) {
        return bucketFor(sourceName).status();
    }

    TokenBucket bucketFor(String sourceName) {
        return buckets.computeIfAbsent(sourceName.toUpperCase(Locale.ROOT), key -> {
            CollectorProperties.RateLimit limit = properties.rateLimitFor(key);
            logger.info("Rate limiter for {}: capacity={}, refill={}/s",
                    key, limit.getCapacity(), limit.getRefillPerSecond());
            return new TokenBucket(limit.getCapacity(), limit.getRefillPerSecond(), nanoTime);
        });
    }
}
