package com.openrangelabs.blacklist.collector.parser;

/**
 * Reads one export format into normalized records.
 * Implementations report unreadable content through {@link ParseResult#failure}, never by throwing.
 */
public interface BlacklistFileParser {

    String getFormat();

    ParseResult parse(byte[] content, String sourceName);
}
