package com.researchbot.session;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionManagerTest {

    @Test
    void createSession_shouldFailWhenCapacityReached() {
        SessionManager manager = new SessionManager(new MutableClock(), Duration.ofMinutes(10), 2);
        manager.createSession();
        manager.createSession();

        ResearchException e = assertThrows(ResearchException.class, manager::createSession);

        assertEquals(FailureKind.CAPACITY_EXCEEDED, e.kind());
    }

    @Test
    void createSession_shouldReclaimCapacityFromExpiredSessions() {
        MutableClock clock = new MutableClock();
        SessionManager manager = new SessionManager(clock, Duration.ofSeconds(60), 1);
        Session first = manager.createSession();

        clock.advance(Duration.ofSeconds(60));
        Session second = manager.createSession();

        assertFalse(first.id.equals(second.id));
        assertTrue(first.isClosed());
        assertEquals(1, manager.activeCount());
    }

    @Test
    void get_shouldReportExpiredAtExactBoundary() {
        MutableClock clock = new MutableClock();
        SessionManager manager = new SessionManager(clock, Duration.ofSeconds(60), 5);
        Session s = manager.createSession();

        clock.advance(Duration.ofSeconds(59));
        assertSame(s, manager.get(s.id));

        clock.advance(Duration.ofSeconds(60));
        ResearchException e = assertThrows(ResearchException.class, () -> manager.get(s.id));
        assertEquals(FailureKind.SESSION_EXPIRED, e.kind());
        assertEquals(0, manager.activeCount());
    }

    @Test
    void get_shouldRefreshActivity() {
        MutableClock clock = new MutableClock();
        SessionManager manager = new SessionManager(clock, Duration.ofSeconds(60), 5);
        Session s = manager.createSession();

        clock.advance(Duration.ofSeconds(40));
        manager.get(s.id);
        clock.advance(Duration.ofSeconds(40));

        assertSame(s, manager.get(s.id));
        assertEquals(clock.instant(), s.lastActivity());
    }

    @Test
    void get_shouldReportUnknownSessionAsNotFound() {
        SessionManager manager = new SessionManager(new MutableClock(), Duration.ofSeconds(60), 5);

        ResearchException e = assertThrows(ResearchException.class, () -> manager.get("missing"));

        assertEquals(FailureKind.SESSION_NOT_FOUND, e.kind());
    }

    @Test
    void touch_shouldFailForClosedAndExpiredSessions() {
        MutableClock clock = new MutableClock();
        SessionManager manager = new SessionManager(clock, Duration.ofSeconds(60), 5);
        Session closed = manager.createSession();
        Session idle = manager.createSession();
        manager.close(closed.id);

        assertEquals(FailureKind.SESSION_NOT_FOUND,
                assertThrows(ResearchException.class, () -> manager.touch(closed.id)).kind());

        clock.advance(Duration.ofSeconds(61));
        assertEquals(FailureKind.SESSION_NOT_FOUND,
                assertThrows(ResearchException.class, () -> manager.touch(idle.id)).kind());
    }

    @Test
    void close_shouldBeIdempotent() {
        SessionManager manager = new SessionManager(new MutableClock(), Duration.ofSeconds(60), 5);
        Session s = manager.createSession();

        assertTrue(manager.close(s.id));
        assertFalse(manager.close(s.id));
        assertFalse(manager.close("never-existed"));
        assertTrue(s.isClosed());
    }

    @Test
    void sessionSummary_shouldExposeTickersAndMetadata() {
        SessionManager manager = new SessionManager(new MutableClock(), Duration.ofSeconds(60), 5);
        Session s = manager.createSession();
        s.recordTicker("AAPL");
        s.recordTicker("AAPL");
        s.putMetadata("mode", "batch");

        SessionManager.SessionSummary summary = manager.sessionSummary(s.id);

        assertEquals(List.of("AAPL"), summary.tickers());
        assertEquals("batch", summary.metadata().get("mode"));
    }

    @Test
    void sweepExpired_shouldEvictOnlyIdleSessions() {
        MutableClock clock = new MutableClock();
        SessionManager manager = new SessionManager(clock, Duration.ofSeconds(60), 5);
        Session idleA = manager.createSession();
        Session idleB = manager.createSession();
        Session busy = manager.createSession();

        clock.advance(Duration.ofSeconds(30));
        manager.touch(busy.id);
        clock.advance(Duration.ofSeconds(30));

        assertEquals(2, manager.sweepExpired());
        assertEquals(List.of(busy.id), manager.activeSessionIds());
        assertTrue(idleA.isClosed());
        assertTrue(idleB.isClosed());
        assertFalse(busy.isClosed());
        assertEquals(FailureKind.SESSION_EXPIRED,
                assertThrows(ResearchException.class, () -> manager.get(idleA.id)).kind());
        assertEquals(0, manager.sweepExpired());
    }

    @Test
    void recordTicker_shouldKeepOneEntryWhenWorkersRace() throws Exception {
        SessionManager manager = new SessionManager(Duration.ofMinutes(5), 5);
        Session s = manager.createSession();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                String ticker = i % 2 == 0 ? "AAPL" : "MSFT";
                futures.add(pool.submit(() -> {
                    start.await();
                    s.recordTicker(ticker);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> tickers = s.tickers();
        assertEquals(2, tickers.size());
        assertTrue(tickers.containsAll(List.of("AAPL", "MSFT")));
    }

    @Test
    void createSession_shouldNeverReuseIdsUnderConcurrency() throws Exception {
        SessionManager manager = new SessionManager(Duration.ofMinutes(5), 200);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Session>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(manager::createSession));
            }
            Set<String> ids = new HashSet<>();
            for (Future<Session> f : futures) {
                ids.add(f.get(5, TimeUnit.SECONDS).id);
            }
            assertEquals(200, ids.size());
            assertEquals(200, manager.activeCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void constructor_shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new SessionManager(Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> new SessionManager(Duration.ofSeconds(1), 0));
    }

    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-05T09:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
