package com.openrangelabs.blacklist.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Counts produced by one sink batch.
 */
@Value
@Builder
@AllArgsConstructor
public class UpsertResult {

    int inserted;
    int updated;
    int unchanged;
    int rejected;

    public static UpsertResult empty() {
        return new UpsertResult(0, 0, 0, 0);
    }

    /**
     * Records that exist in storage after the batch, new or not.
     */
    public int getPersisted() {
        return inserted + updated + unchanged;
    }

    /**
     * Records that were already stored before the batch.
     */
    public int getExisting() {
        return updated + unchanged;
    }
}
