package com.researchbot.session;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the session table. A session is visible while {@code now - lastActivity < expiry};
 * expired sessions are evicted lazily on {@link #createSession()} and {@link #get(String)}.
 */
public final class SessionManager {
    private static final Logger log = LogManager.getLogger(SessionManager.class);
    private static final int RETIRED_ID_MEMORY = 1024;

    private final Clock clock;
    private final Duration expiry;
    private final int maxConcurrent;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    // Recently expired ids, so a late get() reports SESSION_EXPIRED rather than SESSION_NOT_FOUND.
    private final Map<String, Boolean> expiredIds = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > RETIRED_ID_MEMORY;
        }
    };

    public SessionManager(Duration expiry, int maxConcurrent) {
        this(Clock.systemUTC(), expiry, maxConcurrent);
    }

    public SessionManager(Clock clock, Duration expiry, int maxConcurrent) {
        if (expiry == null || expiry.isZero() || expiry.isNegative()) {
            throw new IllegalArgumentException("session expiry must be positive");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("session.max_concurrent must be >= 1");
        }
        this.clock = clock;
        this.expiry = expiry;
        this.maxConcurrent = maxConcurrent;
    }

    public Session createSession() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            sweepLocked(now);
            if (sessions.size() >= maxConcurrent) {
                throw new ResearchException(
                        FailureKind.CAPACITY_EXCEEDED,
                        "active sessions at limit " + maxConcurrent
                );
            }
            String id = UUID.randomUUID().toString();
            while (sessions.containsKey(id) || expiredIds.containsKey(id)) {
                id = UUID.randomUUID().toString();
            }
            Session session = new Session(id, now, expiry);
            sessions.put(id, session);
            log.info("[{}] session created (active={})", id, sessions.size());
            return session;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the live session and refreshes its activity.
     *
     * @throws ResearchException SESSION_EXPIRED when idle too long, SESSION_NOT_FOUND when unknown or closed
     */
    public Session get(String sessionId) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Session session = sessions.get(sessionId);
            if (session != null && session.isExpiredAt(now)) {
                evictLocked(session);
                session = null;
            }
            sweepLocked(now);
            if (session == null) {
                if (sessionId != null && expiredIds.containsKey(sessionId)) {
                    throw new ResearchException(FailureKind.SESSION_EXPIRED, "session expired: " + sessionId);
                }
                throw new ResearchException(FailureKind.SESSION_NOT_FOUND, "session not found: " + sessionId);
            }
            session.touch(now);
            return session;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Refreshes activity. Any session that is not live (unknown, closed or expired) is reported
     * as SESSION_NOT_FOUND; in-flight runs use this as their cancellation check.
     */
    public Session touch(String sessionId) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Session session = sessions.get(sessionId);
            if (session == null || session.isClosed()) {
                throw new ResearchException(FailureKind.SESSION_NOT_FOUND, "session not found: " + sessionId);
            }
            if (session.isExpiredAt(now)) {
                evictLocked(session);
                throw new ResearchException(FailureKind.SESSION_NOT_FOUND, "session no longer active: " + sessionId);
            }
            session.touch(now);
            return session;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closing an unknown or already closed session is a no-op.
     *
     * @return true when a live session was closed
     */
    public boolean close(String sessionId) {
        lock.writeLock().lock();
        try {
            Session session = sessions.remove(sessionId);
            if (session == null) {
                return false;
            }
            session.markClosed();
            log.info("[{}] session closed (active={})", sessionId, sessions.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int sweepExpired() {
        lock.writeLock().lock();
        try {
            return sweepLocked(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int activeCount() {
        return activeSessionIds().size();
    }

    public List<String> activeSessionIds() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<String> out = new ArrayList<>();
            for (Session s : sessions.values()) {
                if (!s.isExpiredAt(now)) {
                    out.add(s.id);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Read-only view of a live session; does not count as activity.
     */
    public SessionSummary sessionSummary(String sessionId) {
        lock.readLock().lock();
        try {
            Session s = sessions.get(sessionId);
            if (s == null || s.isExpiredAt(clock.instant())) {
                throw new ResearchException(FailureKind.SESSION_NOT_FOUND, "session not found: " + sessionId);
            }
            return new SessionSummary(s.id, s.createdAt, s.lastActivity(), s.tickers(), s.metadata());
        } finally {
            lock.readLock().unlock();
        }
    }

    private int sweepLocked(Instant now) {
        int evicted = 0;
        Iterator<Session> it = sessions.values().iterator();
        while (it.hasNext()) {
            Session s = it.next();
            if (s.isExpiredAt(now)) {
                it.remove();
                s.markClosed();
                expiredIds.put(s.id, Boolean.TRUE);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("evicted {} expired session(s), active={}", evicted, sessions.size());
        }
        return evicted;
    }

    private void evictLocked(Session session) {
        sessions.remove(session.id);
        session.markClosed();
        expiredIds.put(session.id, Boolean.TRUE);
        log.info("[{}] session expired", session.id);
    }

    public record SessionSummary(
            String id,
            Instant createdAt,
            Instant lastActivity,
            List<String> tickers,
            Map<String, String> metadata
    ) {
    }
}
