package com.openrangelabs.blacklist.collector.parser;

import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.model.NormalizedIpRecord;

import java.util.List;

/**
 * Outcome of one parser attempt: either the records read, or why the content
 * could not be read at all. Record-level problems are counted, never failures.
 */
public final class ParseResult {

    private final boolean success;
    private final String format;
    private final List<NormalizedIpRecord> records;
    private final int droppedCount;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private ParseResult(boolean success, String format, List<NormalizedIpRecord> records,
                        int droppedCount, ErrorKind errorKind, String errorMessage) {
        this.success = success;
        this.format = format;
        this.records = records;
        this.droppedCount = droppedCount;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static ParseResult success(String format, List<NormalizedIpRecord> records, int droppedCount) {
        return new ParseResult(true, format, List.copyOf(records), droppedCount, null, null);
    }

    public static ParseResult failure(String format, ErrorKind errorKind, String errorMessage) {
        return new ParseResult(false, format, List.of(), 0, errorKind, errorMessage);
    }

    public boolean isSuccess() { return success; }
    public String getFormat() { return format; }
    public List<NormalizedIpRecord> getRecords() { return records; }
    public int getDroppedCount() { return droppedCount; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return success
                ? "ParseResult{format=" + format + ", records=" + records.size() + ", dropped=" + droppedCount + '}'
                : "ParseResult{format=" + format + ", error=" + errorKind + ", message='" + errorMessage + "'}";
    }
}
