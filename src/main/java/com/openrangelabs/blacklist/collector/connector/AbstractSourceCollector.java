package com.openrangelabs.blacklist.collector.connector;

import com.openrangelabs.blacklist.collector.exception.ParseException;
import com.openrangelabs.blacklist.collector.model.CollectionResult;
import com.openrangelabs.blacklist.collector.model.CollectorState;
import com.openrangelabs.blacklist.collector.model.Credential;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.parser.BlacklistFileParser;
import com.openrangelabs.blacklist.collector.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Abstract base class for source collectors.
 * Drives the session state machine and the primary/fallback parse chain; subclasses
 * implement only the portal protocol.
 */
public abstract class AbstractSourceCollector implements SourceCollector {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final BlacklistFileParser primaryParser;
    private final List<BlacklistFileParser> fallbackParsers;
    protected final Clock clock;

    private final AtomicLong fallbackParses = new AtomicLong(0);

    protected AbstractSourceCollector(BlacklistFileParser primaryParser, List<BlacklistFileParser> fallbackParsers,
                                      Clock clock) {
        this.primaryParser = primaryParser;
        this.fallbackParsers = List.copyOf(fallbackParsers);
        this.clock = clock;
    }

    @Override
    public Mono<CollectorSession> authenticate(Credential credential) {
        return Mono.defer(() -> {
            CollectorSession session = new CollectorSession(getSourceName(), credential);
            session.transitionTo(CollectorState.AUTHENTICATING);
            return doAuthenticate(session)
                    .then(Mono.fromCallable(() -> {
                        session.setAuthenticatedAt(clock.instant());
                        session.transitionTo(CollectorState.AUTHENTICATED);
                        logger.info("Authenticated to {} as {}", getSourceName(), credential.getUsername());
                        return session;
                    }))
                    .doOnError(error -> session.markFailed());
        });
    }

    @Override
    public Mono<CollectionResult> fetch(CollectorSession session, DateWindow window) {
        String batchId = batchIdentifier(window);
        return Mono.defer(() -> {
            session.transitionTo(CollectorState.FETCHING);
            return doFetch(session, window)
                    .publishOn(Schedulers.boundedElastic())
                    .map(content -> parse(content, batchId))
                    .defaultIfEmpty(CollectionResult.empty(batchId))
                    .doOnNext(result -> {
                        session.transitionTo(CollectorState.PARSED);
                        session.transitionTo(CollectorState.DONE);
                        logger.info("Fetched {} records ({} dropped, {}) for {}",
                                result.size(), result.getDroppedCount(), result.getFormat(), batchId);
                    })
                    .doOnError(error -> session.markFailed());
        });
    }

    /**
     * Tries the primary parser, then each fallback in order.
     */
    protected CollectionResult parse(byte[] content, String batchId) {
        ParseResult primary = primaryParser.parse(content, getSourceName());
        if (primary.isSuccess()) {
            return toResult(primary, batchId);
        }

        logger.warn("Primary {} parse failed for {} ({}), trying fallback parsers",
                primary.getFormat(), batchId, primary.getErrorMessage());
        fallbackParses.incrementAndGet();
        List<String> failures = new ArrayList<>();
        failures.add(primary.getFormat() + ": " + primary.getErrorMessage());
        ParseResult last = primary;
        for (BlacklistFileParser fallbackParser : fallbackParsers) {
            ParseResult attempt = fallbackParser.parse(content, getSourceName());
            if (attempt.isSuccess()) {
                return toResult(attempt, batchId);
            }
            logger.debug("Fallback {} parse failed for {}: {}", attempt.getFormat(), batchId, attempt.getErrorMessage());
            failures.add(attempt.getFormat() + ": " + attempt.getErrorMessage());
            last = attempt;
        }

        throw new ParseException(last.getErrorKind(), getSourceName(),
                "Export for " + batchId + " unreadable: " + String.join("; ", failures));
    }

    private CollectionResult toResult(ParseResult parsed, String batchId) {
        return new CollectionResult(parsed.getRecords(), batchId, parsed.getDroppedCount(), parsed.getFormat());
    }

    public long getFallbackParseCount() {
        return fallbackParses.get();
    }

    /**
     * Template method for the portal login; completes when the session is usable.
     */
    protected abstract Mono<Void> doAuthenticate(CollectorSession session);

    /**
     * Template method for the export download; empty when the window holds no data.
     */
    protected abstract Mono<byte[]> doFetch(CollectorSession session, DateWindow window);
}
