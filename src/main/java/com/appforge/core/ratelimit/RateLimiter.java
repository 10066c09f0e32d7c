package com.appforge.core.ratelimit;

import com.appforge.core.events.TelemetryEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-window admission control, one independent window per operation type.
 * <p>
 * A slot is taken with a single conditional increment against the store, so two
 * callers can never both see the last free slot. Denied calls do not touch the
 * counter. This class only answers yes or no; queueing a denied operation is the
 * caller's job.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /** Bound on lost races before giving up; each loss means someone else made progress. */
    private static final int MAX_CONTENTION_RETRIES = 16;

    private static final Duration CONTENTION_RETRY_AFTER = Duration.ofSeconds(1);

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final TelemetryEmitter telemetry;
    private final Clock clock;

    public RateLimiter(RateLimitStore store, RateLimitProperties properties,
                       TelemetryEmitter telemetry, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    public AdmissionDecision admit(String operationType) {
        return admit(operationType, AdmissionLane.LIVE);
    }

    public AdmissionDecision admit(String operationType, AdmissionLane lane) {
        AdmissionDecision decision = decide(operationType, lane);
        telemetry.admission(operationType, decision.allowed());
        if (!decision.allowed()) {
            log.warn("Rate limit denied {} ({} lane), retry after {}s",
                    operationType, lane, decision.retryAfter().toSeconds());
        }
        return decision;
    }

    private AdmissionDecision decide(String operationType, AdmissionLane lane) {
        Duration window = properties.getWindow();
        int limit = properties.limitFor(operationType);
        int ceiling = lane == AdmissionLane.QUEUED ? limit : properties.liveCeilingFor(operationType);

        for (int attempt = 0; attempt < MAX_CONTENTION_RETRIES; attempt++) {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            Optional<RateLimitWindow> current = store.find(operationType);

            if (current.isEmpty() || current.get().isExpired(now, window)) {
                Instant expected = current.map(RateLimitWindow::windowStart).orElse(null);
                if (store.openWindow(operationType, expected, now, limit)) {
                    log.debug("Opened new {} window at {}", operationType, now);
                }
                continue;
            }

            RateLimitWindow w = current.get();
            if (w.count() >= ceiling) {
                return AdmissionDecision.deny(w.remaining(now, window));
            }
            if (store.tryIncrement(operationType, w.windowStart(), ceiling)) {
                return AdmissionDecision.allow();
            }
        }

        log.warn("Rate limiter gave up on {} after {} contended attempts", operationType, MAX_CONTENTION_RETRIES);
        return AdmissionDecision.deny(CONTENTION_RETRY_AFTER);
    }

    /**
     * Current usage per configured or observed operation type. Expired windows report zero.
     */
    public List<RateLimitUsage> usage() {
        Instant now = clock.instant();
        Duration window = properties.getWindow();
        var seen = new ArrayList<String>(properties.getLimits().keySet());
        var usages = new ArrayList<RateLimitUsage>();

        for (RateLimitWindow w : store.findAll()) {
            seen.remove(w.operationType());
            int limit = properties.limitFor(w.operationType());
            int count = w.isExpired(now, window) ? 0 : w.count();
            Instant start = w.isExpired(now, window) ? null : w.windowStart();
            usages.add(new RateLimitUsage(w.operationType(), count, limit, start, Math.max(limit - count, 0)));
        }
        for (String operationType : seen) {
            int limit = properties.limitFor(operationType);
            usages.add(new RateLimitUsage(operationType, 0, limit, null, limit));
        }
        usages.sort(Comparator.comparing(RateLimitUsage::operationType));
        return usages;
    }

    /**
     * Drops windows that ended more than one window length ago.
     */
    public int purgeExpired() {
        Duration window = properties.getWindow();
        Instant cutoff = clock.instant().minus(window).minus(window);
        int removed = store.deleteWindowsStartedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} expired rate-limit windows", removed);
        }
        return removed;
    }
}
