package com.openrangelabs.blacklist.collector.connector;

import com.openrangelabs.blacklist.collector.model.CollectorState;
import com.openrangelabs.blacklist.collector.model.Credential;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Portal session of a single collection run. Holds the cookies and token obtained
 * during authentication and tracks the run's protocol state. Not shared between runs.
 */
public class CollectorSession {

    private final String sourceName;
    private final Credential credential;
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private volatile CollectorState state = CollectorState.UNAUTHENTICATED;
    private String bearerToken;
    private Instant authenticatedAt;

    public CollectorSession(String sourceName, Credential credential) {
        this.sourceName = sourceName;
        this.credential = credential;
    }

    /**
     * Moves to {@code next}, rejecting transitions the run lifecycle does not allow.
     */
    public synchronized void transitionTo(CollectorState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(sourceName + " session cannot move from " + state + " to " + next);
        }
        state = next;
    }

    public synchronized void markFailed() {
        if (state != CollectorState.DONE && state != CollectorState.FAILED) {
            state = CollectorState.FAILED;
        }
    }

    public synchronized void putCookie(String name, String value) {
        cookies.put(name, value);
    }

    public synchronized Map<String, String> getCookies() {
        return Map.copyOf(cookies);
    }

    public synchronized String getCookie(String name) {
        return cookies.get(name);
    }

    public CollectorState getState() { return state; }
    public String getSourceName() { return sourceName; }
    public Credential getCredential() { return credential; }

    public String getBearerToken() { return bearerToken; }
    public void setBearerToken(String bearerToken) { this.bearerToken = bearerToken; }

    public Instant getAuthenticatedAt() { return authenticatedAt; }
    public void setAuthenticatedAt(Instant authenticatedAt) { this.authenticatedAt = authenticatedAt; }

    public boolean isAuthenticated() {
        return state == CollectorState.AUTHENTICATED || state == CollectorState.FETCHING
                || state == CollectorState.PARSED;
    }

    @Override
    public String toString() {
        return "CollectorSession{" +
                "sourceName='" + sourceName + '\'' +
                ", state=" + state +
                ", cookies=" + cookies.keySet() +
                ", authenticatedAt=" + authenticatedAt +
                '}';
    }
}
