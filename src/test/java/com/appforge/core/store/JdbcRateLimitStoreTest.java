package com.appforge.core.store;

import com.appforge.core.ratelimit.RateLimitProperties;
import com.appforge.core.ratelimit.RateLimiter;
import com.appforge.support.MutableClock;
import com.appforge.support.TestTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRateLimitStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcRateLimitStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new JdbcRateLimitStore(H2DataSources.fresh());
        store.createTables();
    }

    @Test
    @DisplayName("opening a window twice from nothing succeeds only once")
    void openWindowOnce() {
        assertTrue(store.openWindow("op", null, T0, 5));
        assertFalse(store.openWindow("op", null, T0.plusSeconds(1), 5));

        var window = store.find("op").orElseThrow();
        assertEquals(T0, window.windowStart());
        assertEquals(0, window.count());
        assertEquals(5, window.limit());
    }

    @Test
    @DisplayName("replacing a window requires the expected start")
    void replaceWindow() {
        store.openWindow("op", null, T0, 5);
        Instant next = T0.plus(Duration.ofHours(1));

        assertFalse(store.openWindow("op", T0.minusSeconds(1), next, 5));
        assertTrue(store.openWindow("op", T0, next, 5));
        assertEquals(next, store.find("op").orElseThrow().windowStart());
    }

    @Test
    @DisplayName("increment stops at the ceiling and ignores stale windows")
    void incrementRespectsCeiling() {
        store.openWindow("op", null, T0, 2);

        assertTrue(store.tryIncrement("op", T0, 2));
        assertTrue(store.tryIncrement("op", T0, 2));
        assertFalse(store.tryIncrement("op", T0, 2));
        assertFalse(store.tryIncrement("op", T0.minusSeconds(5), 10));
        assertEquals(2, store.find("op").orElseThrow().count());
    }

    @Test
    @DisplayName("old windows are deleted")
    void deleteOld() {
        store.openWindow("a", null, T0, 1);
        store.openWindow("b", null, T0.plusSeconds(3600), 1);

        assertEquals(1, store.deleteWindowsStartedBefore(T0.plusSeconds(10)));
        assertEquals(1, store.findAll().size());
    }

    @Test
    @DisplayName("two limiters sharing the database share one budget")
    void sharedBudgetAcrossLimiters() {
        var clock = new MutableClock(T0);
        var props = new RateLimitProperties();
        props.setLimits(Map.of("op", 3));
        props.setQueueReserveFraction(0.0);
        var first = new RateLimiter(store, props, TestTelemetry.emitter(clock), clock);
        var second = new RateLimiter(store, props, TestTelemetry.emitter(clock), clock);

        assertTrue(first.admit("op").allowed());
        assertTrue(second.admit("op").allowed());
        assertTrue(first.admit("op").allowed());
        assertFalse(second.admit("op").allowed());
    }
}
