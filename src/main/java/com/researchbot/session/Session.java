package com.researchbot.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An isolated research context. Activity and closing are driven by {@link SessionManager}.
 */
public final class Session {
    public final String id;
    public final Instant createdAt;
    public final Duration expiry;

    private volatile Instant lastActivity;
    private volatile boolean closed;
    private final Map<String, String> metadata = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> tickers = new CopyOnWriteArrayList<>();

    Session(String id, Instant createdAt, Duration expiry) {
        this.id = id;
        this.createdAt = createdAt;
        this.expiry = expiry;
        this.lastActivity = createdAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isExpiredAt(Instant now) {
        return Duration.between(lastActivity, now).compareTo(expiry) >= 0;
    }

    public void putMetadata(String key, String value) {
        if (key == null || value == null) {
            return;
        }
        metadata.put(key, value);
    }

    public Map<String, String> metadata() {
        return Map.copyOf(metadata);
    }

    public void recordTicker(String ticker) {
        if (ticker != null) {
            tickers.addIfAbsent(ticker);
        }
    }

    public List<String> tickers() {
        return new ArrayList<>(tickers);
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    void markClosed() {
        this.closed = true;
    }
}
