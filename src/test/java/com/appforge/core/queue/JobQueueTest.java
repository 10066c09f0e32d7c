package com.appforge.core.queue;

import com.appforge.core.admission.AdmissionGate;
import com.appforge.core.admission.CircuitOpenException;
import com.appforge.core.breaker.CircuitBreaker;
import com.appforge.core.breaker.CircuitBreakerProperties;
import com.appforge.core.breaker.InMemoryCircuitBreakerStore;
import com.appforge.core.events.TelemetryEmitter;
import com.appforge.core.ratelimit.AdmissionLane;
import com.appforge.core.ratelimit.InMemoryRateLimitStore;
import com.appforge.core.ratelimit.RateLimitProperties;
import com.appforge.core.ratelimit.RateLimiter;
import com.appforge.support.MutableClock;
import com.appforge.support.TestTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AdmissionGate gate;
    private InMemoryJobStore store;
    private QueueProperties properties;
    private final List<JobHandler> handlers = new ArrayList<>();
    private JobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        TelemetryEmitter telemetry = TestTelemetry.emitter(clock);
        breaker = new CircuitBreaker(new InMemoryCircuitBreakerStore(), new CircuitBreakerProperties(), telemetry, clock);

        var limitProps = new RateLimitProperties();
        limitProps.setLimits(Map.of("create", 2));
        gate = new AdmissionGate(breaker, new RateLimiter(new InMemoryRateLimitStore(), limitProps, telemetry, clock));

        store = new InMemoryJobStore();
        properties = new QueueProperties();
        properties.setMaxAttempts(3);
        queue = new JobQueue(store, breaker, properties, telemetry, clock, () -> handlers);
    }

    private JobHandler handler(String action, Runnable body) {
        return new JobHandler() {
            @Override
            public String action() {
                return action;
            }

            @Override
            public void handle(PendingJob job) {
                body.run();
            }
        };
    }

    private JobStatus status(String jobId) {
        return queue.find(jobId).orElseThrow().status();
    }

    @Test
    @DisplayName("enqueue persists a PENDING job with zero attempts")
    void enqueue() {
        String id = queue.enqueue("create", "provision", Map.of("owner", "FRAG-1"));

        PendingJob job = queue.find(id).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(0, job.attempts());
        assertEquals("FRAG-1", job.payloadString("owner"));
        assertEquals(clock.instant(), job.enqueuedAt());
    }

    @Test
    @DisplayName("with a limit of two, the third deferred job waits for the next window")
    void thirdJobWaitsForNextWindow() {
        var created = new ArrayList<String>();
        handlers.add(new JobHandler() {
            @Override
            public String action() {
                return "provision";
            }

            @Override
            public void handle(PendingJob job) {
                gate.run("create", AdmissionLane.QUEUED, () -> created.add(job.payloadString("owner")));
            }
        });
        String a = queue.enqueue("create", "provision", Map.of("owner", "A"));
        clock.advance(Duration.ofMillis(1));
        String b = queue.enqueue("create", "provision", Map.of("owner", "B"));
        clock.advance(Duration.ofMillis(1));
        String c = queue.enqueue("create", "provision", Map.of("owner", "C"));

        assertEquals(2, queue.sweep());
        assertEquals(List.of("A", "B"), created);
        assertEquals(JobStatus.COMPLETED, status(a));
        assertEquals(JobStatus.COMPLETED, status(b));
        assertEquals(JobStatus.PENDING, status(c));
        assertEquals(0, queue.find(c).orElseThrow().attempts());

        clock.advance(Duration.ofHours(1));
        assertEquals(1, queue.sweep());
        assertEquals(List.of("A", "B", "C"), created);
        assertEquals(JobStatus.COMPLETED, status(c));
    }

    @Test
    @DisplayName("higher priority jobs run first within an operation type")
    void priorityOrder() {
        var order = new ArrayList<String>();
        handlers.add(new JobHandler() {
            @Override
            public String action() {
                return "record";
            }

            @Override
            public void handle(PendingJob job) {
                order.add(job.payloadString("name"));
            }
        });
        queue.enqueue("op", "record", Map.of("name", "normal"));
        clock.advance(Duration.ofMillis(1));
        queue.enqueue("op", "record", Map.of("name", "high"), JobPriority.HIGH);

        queue.sweep();

        assertEquals(List.of("high", "normal"), order);
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a failing handler spends attempts until the job is FAILED")
        void failsAfterMaxAttempts() {
            handlers.add(handler("flaky", () -> { throw new IllegalStateException("nope"); }));
            String id = queue.enqueue("op", "flaky", Map.of());

            queue.sweep();
            queue.sweep();
            assertEquals(JobStatus.PENDING, status(id));
            assertEquals(2, queue.find(id).orElseThrow().attempts());

            queue.sweep();
            PendingJob job = queue.find(id).orElseThrow();
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals("nope", job.lastError());
            assertNotNull(job.finishedAt());
        }

        @Test
        @DisplayName("a job without a handler fails permanently")
        void missingHandler() {
            String id = queue.enqueue("op", "unknown", Map.of());
            queue.sweep();
            assertEquals(JobStatus.FAILED, status(id));
        }

        @Test
        @DisplayName("a circuit-open denial stops the sweep and spends no attempt")
        void circuitOpenStopsSweep() {
            var calls = new ArrayList<String>();
            handlers.add(new JobHandler() {
                @Override
                public String action() {
                    return "open";
                }

                @Override
                public void handle(PendingJob job) {
                    calls.add(job.id());
                    throw new CircuitOpenException(CircuitBreaker.SANDBOX, Duration.ofSeconds(30));
                }
            });
            String first = queue.enqueue("op", "open", Map.of());
            clock.advance(Duration.ofMillis(1));
            queue.enqueue("op2", "open", Map.of());

            assertEquals(0, queue.sweep());

            assertEquals(List.of(first), calls);
            assertEquals(0, queue.find(first).orElseThrow().attempts());
            assertEquals(JobStatus.PENDING, status(first));
        }
    }

    @Test
    @DisplayName("a second sweep does not re-execute completed jobs")
    void sweepIsIdempotent() {
        var calls = new ArrayList<String>();
        handlers.add(handler("noop", () -> calls.add("x")));
        String id = queue.enqueue("op", "noop", Map.of());

        assertEquals(1, queue.sweep());
        assertEquals(0, queue.sweep());

        assertEquals(1, calls.size());
        assertEquals(JobStatus.COMPLETED, status(id));
    }

    @Test
    @DisplayName("sweep is skipped entirely while the breaker is open")
    void skipsWhileBreakerOpen() {
        var calls = new ArrayList<String>();
        handlers.add(handler("noop", () -> calls.add("x")));
        queue.enqueue("op", "noop", Map.of());
        for (int i = 0; i < 5; i++) {
            assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
                throw new IllegalStateException("down");
            }));
        }

        assertEquals(0, queue.sweep());
        assertTrue(calls.isEmpty());
    }

    @Test
    @DisplayName("jobs stuck in PROCESSING past the lease are requeued")
    void staleClaimsRequeued() {
        String id = queue.enqueue("op", "noop", Map.of());
        assertTrue(store.claim(id, clock.instant()));
        handlers.add(handler("noop", () -> { }));

        clock.advance(properties.getProcessingLease().plusSeconds(1));
        queue.sweep();

        assertEquals(JobStatus.COMPLETED, status(id));
    }

    @Test
    @DisplayName("stats report depth by status and the oldest pending age")
    void stats() {
        queue.enqueue("op", "noop", Map.of());
        clock.advance(Duration.ofMinutes(3));
        queue.enqueue("op", "noop", Map.of());

        QueueStats stats = queue.stats();

        assertEquals(2L, stats.depthByStatus().get(JobStatus.PENDING));
        assertEquals(Duration.ofMinutes(3), stats.oldestPendingAge());
    }

    @Test
    @DisplayName("cleanup removes finished jobs older than the retention period")
    void cleanup() {
        handlers.add(handler("noop", () -> { }));
        String id = queue.enqueue("op", "noop", Map.of());
        queue.sweep();

        clock.advance(properties.getRetention().plusSeconds(1));
        assertEquals(1, queue.cleanup());
        assertTrue(queue.find(id).isEmpty());
    }
}
