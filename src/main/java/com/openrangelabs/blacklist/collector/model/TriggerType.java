package com.openrangelabs.blacklist.collector.model;

public enum TriggerType {
    SCHEDULED,
    MANUAL
}
