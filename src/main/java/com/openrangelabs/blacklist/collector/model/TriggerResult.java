package com.openrangelabs.blacklist.collector.model;

/**
 * Answer to a manual trigger request. None of these values is an error.
 */
public enum TriggerResult {
    ACCEPTED,
    ALREADY_RUNNING,
    DISABLED
}
