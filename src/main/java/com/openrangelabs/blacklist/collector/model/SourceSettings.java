package com.openrangelabs.blacklist.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Effective scheduling configuration of one source.
 */
@Value
@Builder(toBuilder = true)
public class SourceSettings {

    String sourceName;
    boolean enabled;
    Duration interval;
    Duration maxBackoff;
    int scheduledWindowDays;
    int backfillWindowDays;
}
