package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Transport level failure talking to a source portal.
 */
public class NetworkException extends CollectionException {

    private final Integer statusCode;

    public NetworkException(ErrorKind errorKind, String sourceName, String message, Throwable cause) {
        super(errorKind, sourceName, message, cause);
        this.statusCode = null;
    }

    private NetworkException(String sourceName, String message, int statusCode) {
        super(ErrorKind.UNEXPECTED_STATUS, sourceName, message);
        this.statusCode = statusCode;
    }

    public static NetworkException unexpectedStatus(String sourceName, String path, int statusCode) {
        return new NetworkException(sourceName,
                "Unexpected HTTP " + statusCode + " from " + path, statusCode);
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
