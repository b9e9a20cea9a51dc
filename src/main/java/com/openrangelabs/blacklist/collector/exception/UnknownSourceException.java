package com.openrangelabs.blacklist.collector.exception;

/**
 * Thrown when an API caller names a source that has no collector.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class UnknownSourceException extends RuntimeException {

    private final String sourceName;

    public UnknownSourceException(String sourceName) {
        super(String.format("No collector configured for source: %s", sourceName));
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
