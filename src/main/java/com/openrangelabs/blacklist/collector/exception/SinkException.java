package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.model.UpsertResult;

/**
 * Persistence failed part way through a batch.
 *
 * <p>{@link #getPartialResult()} holds the counts committed before the failure.
 */
public class SinkException extends CollectionException {

    private final UpsertResult partialResult;

    public SinkException(String sourceName, UpsertResult partialResult, Throwable cause) {
        super(ErrorKind.SINK_ERROR, sourceName,
                "Record sink failed after " + partialResult.getPersisted() + " records: " + cause.getMessage(),
                cause);
        this.partialResult = partialResult;
    }

    public UpsertResult getPartialResult() {
        return partialResult;
    }
}
