package com.openrangelabs.blacklist.collector.connector;

import com.openrangelabs.blacklist.collector.model.CollectionResult;
import com.openrangelabs.blacklist.collector.model.Credential;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import reactor.core.publisher.Mono;

/**
 * Contract for one external threat intelligence source.
 * There is exactly one implementation per source name.
 */
public interface SourceCollector {

    /**
     * Source identifier, e.g. {@code REGTECH}
     */
    String getSourceName();

    /**
     * Log in to the source portal and open a session for one run
     */
    Mono<CollectorSession> authenticate(Credential credential);

    /**
     * Download and parse the export for a date window
     */
    Mono<CollectionResult> fetch(CollectorSession session, DateWindow window);

    /**
     * Deterministic identifier of the export window, used for dedup
     */
    default String batchIdentifier(DateWindow window) {
        return getSourceName() + ":" + window.start() + ":" + window.end();
    }
}
