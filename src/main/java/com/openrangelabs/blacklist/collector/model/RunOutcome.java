package com.openrangelabs.blacklist.collector.model;

public enum RunOutcome {
    SUCCESS,
    FAILURE,
    PARTIAL
}
