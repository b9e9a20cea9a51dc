package com.openrangelabs.blacklist.collector.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-run protocol state of a source collector. Any state may move to {@link #FAILED}.
 */
public enum CollectorState {
    UNAUTHENTICATED,
    AUTHENTICATING,
    AUTHENTICATED,
    FETCHING,
    PARSED,
    DONE,
    FAILED;

    public boolean canTransitionTo(CollectorState next) {
        if (next == FAILED) {
            return this != DONE;
        }
        return successors().contains(next);
    }

    private Set<CollectorState> successors() {
        return switch (this) {
            case UNAUTHENTICATED -> EnumSet.of(AUTHENTICATING);
            case AUTHENTICATING -> EnumSet.of(AUTHENTICATED);
            case AUTHENTICATED -> EnumSet.of(FETCHING);
            case FETCHING -> EnumSet.of(PARSED);
            case PARSED -> EnumSet.of(DONE);
            case DONE, FAILED -> EnumSet.noneOf(CollectorState.class);
        };
    }
}
