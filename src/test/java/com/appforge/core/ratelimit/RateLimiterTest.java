package com.appforge.core.ratelimit;

import com.appforge.support.MutableClock;
import com.appforge.support.TestTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties properties;
    private InMemoryRateLimitStore store;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = new RateLimitProperties();
        properties.setWindow(Duration.ofHours(1));
        properties.setLimits(Map.of("op", 5));
        properties.setQueueReserveFraction(0.0);
        store = new InMemoryRateLimitStore();
        limiter = new RateLimiter(store, properties, TestTelemetry.emitter(clock), clock);
    }

    @Nested
    @DisplayName("fixed window")
    class FixedWindow {

        @Test
        @DisplayName("admits up to the limit, then denies with the time left in the window")
        void admitsUpToLimit() {
            for (int i = 0; i < 5; i++) {
                assertTrue(limiter.admit("op").allowed(), "call " + i);
            }
            clock.advance(Duration.ofMinutes(15));

            AdmissionDecision denied = limiter.admit("op");

            assertFalse(denied.allowed());
            assertEquals(Duration.ofMinutes(45), denied.retryAfter());
        }

        @Test
        @DisplayName("denied calls do not consume a slot")
        void deniedCallsDoNotCount() {
            for (int i = 0; i < 8; i++) {
                limiter.admit("op");
            }
            assertEquals(5, store.find("op").orElseThrow().count());
        }

        @Test
        @DisplayName("a fresh window opens once the old one has elapsed")
        void windowResets() {
            for (int i = 0; i < 5; i++) {
                limiter.admit("op");
            }
            clock.advance(Duration.ofHours(1));

            assertTrue(limiter.admit("op").allowed());
            var window = store.find("op").orElseThrow();
            assertEquals(1, window.count());
            assertEquals(clock.instant(), window.windowStart());
        }

        @Test
        @DisplayName("operation types have independent windows")
        void independentOperationTypes() {
            properties.setLimits(Map.of("a", 1, "b", 1));
            assertTrue(limiter.admit("a").allowed());
            assertFalse(limiter.admit("a").allowed());
            assertTrue(limiter.admit("b").allowed());
        }

        @Test
        @DisplayName("unlisted operation types fall back to the default limit")
        void defaultLimit() {
            properties.setDefaultLimit(2);
            assertTrue(limiter.admit("other").allowed());
            assertTrue(limiter.admit("other").allowed());
            assertFalse(limiter.admit("other").allowed());
        }
    }

    @Nested
    @DisplayName("queue reserve")
    class QueueReserve {

        @BeforeEach
        void reserve() {
            properties.setLimits(Map.of("op", 10));
            properties.setQueueReserveFraction(0.2);
        }

        @Test
        @DisplayName("live callers stop at the reserve while queued callers use the full window")
        void liveStopsShortOfReserve() {
            for (int i = 0; i < 8; i++) {
                assertTrue(limiter.admit("op", AdmissionLane.LIVE).allowed());
            }
            assertFalse(limiter.admit("op", AdmissionLane.LIVE).allowed());

            assertTrue(limiter.admit("op", AdmissionLane.QUEUED).allowed());
            assertTrue(limiter.admit("op", AdmissionLane.QUEUED).allowed());
            assertFalse(limiter.admit("op", AdmissionLane.QUEUED).allowed());
        }

        @Test
        @DisplayName("a reserve fraction of one or more is rejected")
        void rejectsFullReserve() {
            assertThrows(IllegalArgumentException.class, () -> properties.setQueueReserveFraction(1.0));
        }
    }

    @Test
    @DisplayName("concurrent callers never exceed the limit")
    void concurrentCallersNeverExceedLimit() throws Exception {
        properties.setLimits(Map.of("op", 50));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Boolean>>();
        for (int i = 0; i < 200; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return limiter.admit("op").allowed();
            }));
        }
        start.countDown();

        int allowed = 0;
        for (Future<Boolean> f : futures) {
            if (f.get(10, TimeUnit.SECONDS)) {
                allowed++;
            }
        }
        pool.shutdown();

        assertEquals(50, allowed);
        assertEquals(50, store.find("op").orElseThrow().count());
    }

    @Test
    @DisplayName("usage reports configured types even before any call")
    void usageReportsConfiguredTypes() {
        limiter.admit("op");
        limiter.admit("op");

        var usage = limiter.usage();

        assertEquals(1, usage.size());
        var op = usage.get(0);
        assertEquals("op", op.operationType());
        assertEquals(2, op.count());
        assertEquals(3, op.remaining());
        assertEquals(0.4, op.utilization(), 1e-9);
    }

    @Test
    @DisplayName("expired windows report zero usage and are purged after two window lengths")
    void expiredWindows() {
        limiter.admit("op");
        clock.advance(Duration.ofHours(1));
        assertEquals(0, limiter.usage().get(0).count());

        clock.advance(Duration.ofHours(1).plusSeconds(1));
        assertEquals(1, limiter.purgeExpired());
        assertTrue(store.find("op").isEmpty());
    }
}
