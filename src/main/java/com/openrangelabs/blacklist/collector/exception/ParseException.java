package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Neither the primary nor the fallback parser could read an export.
 */
public class ParseException extends CollectionException {

    public ParseException(ErrorKind errorKind, String sourceName, String message) {
        super(errorKind, sourceName, message);
    }
}
