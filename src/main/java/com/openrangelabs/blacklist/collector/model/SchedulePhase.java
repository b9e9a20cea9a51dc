package com.openrangelabs.blacklist.collector.model;

/**
 * Scheduling phase of a single source.
 */
public enum SchedulePhase {
    IDLE,
    RUNNING,
    BACKOFF,
    DISABLED
}
