package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Base exception for failures while collecting from a source.
 *
 * <p>Every subclass carries the {@link ErrorKind} recorded in the collection
 * history, so a failed run can always be classified without inspecting messages.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CollectionException extends RuntimeException {

    private final ErrorKind errorKind;
    private final String sourceName;

    /**
     * Constructs a new collection exception.
     *
     * @param errorKind the classification of the failure
     * @param sourceName the source being collected
     * @param message the detail message
     */
    public CollectionException(ErrorKind errorKind, String sourceName, String message) {
        super(message);
        this.errorKind = errorKind;
        this.sourceName = sourceName;
    }

    /**
     * Constructs a new collection exception with a cause.
     *
     * @param errorKind the classification of the failure
     * @param sourceName the source being collected
     * @param message the detail message
     * @param cause the cause
     */
    public CollectionException(ErrorKind errorKind, String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.sourceName = sourceName;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getSourceName() {
        return sourceName;
    }
}
