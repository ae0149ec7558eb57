package com.roadside.notification.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Status events arrive at least once and may be redelivered out of order.
 * {@code updatedAt} strictly increases per request, so anything not newer than
 * the last event handled for that request is a duplicate or stale.
 */
@Slf4j
@Component
public class StatusEventDeduplicator {

    private final Map<String, Seen> lastSeen = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public StatusEventDeduplicator(Clock clock,
                                   @Value("${notification.dedup.retention:6h}") Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    /** Records the event and returns true if it is newer than anything seen for the request. */
    public boolean firstSighting(String requestId, Instant updatedAt) {
        if (requestId == null || updatedAt == null) {
            return true;
        }
        AtomicBoolean fresh = new AtomicBoolean(false);
        lastSeen.compute(requestId, (id, previous) -> {
            if (previous != null && !updatedAt.isAfter(previous.updatedAt())) {
                return previous;
            }
            fresh.set(true);
            return new Seen(updatedAt, clock.instant());
        });
        if (!fresh.get()) {
            log.debug("Dropping stale/duplicate event for request {} at {}", requestId, updatedAt);
        }
        return fresh.get();
    }

    @Scheduled(fixedDelayString = "${notification.dedup.prune-interval-ms:600000}")
    public void prune() {
        Instant cutoff = clock.instant().minus(retention);
        int before = lastSeen.size();
        lastSeen.values().removeIf(seen -> seen.recordedAt().isBefore(cutoff));
        int removed = before - lastSeen.size();
        if (removed > 0) {
            log.debug("Pruned {} dedup entries older than {}", removed, retention);
        }
    }

    int size() {
        return lastSeen.size();
    }

    private record Seen(Instant updatedAt, Instant recordedAt) {
    }
}
