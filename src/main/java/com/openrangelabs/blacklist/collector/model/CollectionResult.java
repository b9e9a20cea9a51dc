package com.openrangelabs.blacklist.collector.model;

import lombok.Value;

import java.util.List;

/**
 * Parsed records of one export window.
 */
@Value
public class CollectionResult {

    List<NormalizedIpRecord> records;
    String batchIdentifier;
    int droppedCount;
    String format;

    public static CollectionResult empty(String batchIdentifier) {
        return new CollectionResult(List.of(), batchIdentifier, 0, "none");
    }

    public int size() {
        return records.size();
    }
}
