package com.researchbot.core;

/**
 * Closed set of failure reasons surfaced by sessions, collaborators and the pipeline.
 */
public enum FailureKind {
    CAPACITY_EXCEEDED("capacity_exceeded"),
    SESSION_NOT_FOUND("session_not_found"),
    SESSION_EXPIRED("session_expired"),
    PROVIDER_UNAVAILABLE("provider_unavailable"),
    RATE_LIMITED("rate_limited"),
    TICKER_NOT_FOUND("ticker_not_found"),
    SERVICE_UNAVAILABLE("service_unavailable"),
    RESEARCH_FAILED("research_failed"),
    PERSISTENCE_FAILED("persistence_failed");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Session failures abort a run; they are never degraded into empty data.
     */
    public boolean isSessionFailure() {
        return this == SESSION_NOT_FOUND || this == SESSION_EXPIRED;
    }

    public boolean isRetryable() {
        return this == PROVIDER_UNAVAILABLE
                || this == RATE_LIMITED
                || this == SERVICE_UNAVAILABLE;
    }
}
