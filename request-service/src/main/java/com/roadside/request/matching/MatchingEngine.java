package com.roadside.request.matching;

import com.roadside.request.config.MatchingProperties;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.geo.GeoIndex;
import com.roadside.request.geo.ProviderCandidate;
import com.roadside.request.metrics.LifecycleMetrics;
import com.roadside.request.service.RequestEventPublisher;
import com.roadside.shared.enums.SearchState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Progressive radius search, one {@link SearchSession} per request in SEARCHING.
 *
 * Session flow:
 *  1. startSearch: query the first radius off the caller's thread
 *  2. providers found -> PROVIDER_FOUND, offers fanned out; none -> SEARCHING
 *  3. dwell elapses without an accept -> WAITING_COOLDOWN (offered providers lapse)
 *  4. cooldown elapses -> EXPANDING_RADIUS, next radius queried
 *  5. past the last radius -> TIMEOUT, kept until the client retries or cancels
 *
 * A decline skips the cooldown: the current radius is re-queried without the
 * decliner and, if nobody is left, the session expands at once.
 *
 * Deadlines are driven by {@link #tick(Instant)} from {@link SearchSessionTicker}.
 * The engine never changes the request itself; accepting is the orchestrator's job.
 * While an accept or cancel is being committed the orchestrator holds the
 * session ({@link #hold}), so no offer can go out for a request that is
 * already leaving SEARCHING.
 *
 * Sessions live on the node that started them. Ticks, offers and holds for a
 * request all run on that node; a restart rebuilds them through
 * {@code SearchSessionRecovery}.
 */
@Slf4j
@Component
public class MatchingEngine {

    private final GeoIndex geoIndex;
    private final RequestEventPublisher eventPublisher;
    private final MatchingProperties properties;
    private final LifecycleMetrics metrics;
    private final Clock clock;
    private final Executor executor;
    private final Map<UUID, SearchSession> sessions = new ConcurrentHashMap<>();

    public MatchingEngine(GeoIndex geoIndex,
                          RequestEventPublisher eventPublisher,
                          MatchingProperties properties,
                          LifecycleMetrics metrics,
                          Clock clock,
                          @Qualifier("matchingExecutor") Executor executor) {
        List<Double> ladder = properties.getRadiusLadderKm();
        if (ladder == null || ladder.isEmpty()) {
            throw new IllegalArgumentException("matching.radius-ladder-km must not be empty");
        }
        for (int i = 1; i < ladder.size(); i++) {
            if (ladder.get(i) <= ladder.get(i - 1)) {
                throw new IllegalArgumentException("matching.radius-ladder-km must be strictly ascending: " + ladder);
            }
        }
        this.geoIndex = geoIndex;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Opens a fresh session for a request that just entered SEARCHING. Any
     * previous session for the same request is closed first.
     */
    public SearchSession startSearch(ServiceRequest request) {
        SearchSession session = new SearchSession(request, properties.getRadiusLadderKm(), clock.instant());
        SearchSession previous = sessions.put(request.getId(), session);
        if (previous != null) {
            synchronized (previous) {
                previous.close();
            }
        }
        log.info("Search started for request {} (ladder {} km, {} excluded)",
                request.getId(), session.getRadiusLadder(), session.excludedProviderIds().size());
        executor.execute(() -> runFirstQuery(session));
        return session;
    }

    public void tick(Instant now) {
        for (SearchSession session : sessions.values()) {
            synchronized (session) {
                if (!session.isFrozen()) {
                    advance(session, now);
                }
            }
        }
    }

    /**
     * Applies a decline. The caller has already recorded the exclusion on the
     * request; it is mirrored here before the next query goes out.
     */
    public void forceExpand(UUID requestId, Set<String> requestExclusions) {
        SearchSession session = sessions.get(requestId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.mirrorExclusions(requestExclusions);
            if (session.isFrozen() || session.getState().isFinal()) {
                return;
            }
            Instant now = clock.instant();
            moveTo(session, SearchState.EXPANDING_RADIUS, 0, null, now);
            List<ProviderCandidate> remaining = queryCurrentRadius(session, now);
            if (remaining == null) {
                return;
            }
            if (!remaining.isEmpty()) {
                providersFound(session, remaining, now);
            } else {
                expandToNextRadius(session, now);
            }
        }
    }

    /**
     * Copies the request's exclusions into the live session without querying.
     * Called under the request lock so the next query can no longer reach them.
     */
    public void mirrorExclusions(UUID requestId, Set<String> requestExclusions) {
        SearchSession session = sessions.get(requestId);
        if (session != null) {
            synchronized (session) {
                session.mirrorExclusions(requestExclusions);
            }
        }
    }

    /**
     * Freezes the session while the request lock is held and the request is
     * about to leave SEARCHING. Followed by {@link #discard} or {@link #cancel}
     * once that commits, or by {@link #release} if it rolls back.
     */
    public void hold(UUID requestId) {
        SearchSession session = sessions.get(requestId);
        if (session != null) {
            synchronized (session) {
                session.hold(true);
            }
        }
    }

    /** The held change rolled back; the search picks up where it stopped. */
    public void release(UUID requestId) {
        SearchSession session = sessions.get(requestId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.hold(false);
            if (session.isClosed() || session.getState() != SearchState.IDLE) {
                return;
            }
        }
        executor.execute(() -> runFirstQuery(session));
    }

    /** Client canceled: stop for good and tell observers. */
    public void cancel(UUID requestId) {
        SearchSession session = sessions.remove(requestId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.close();
            if (session.getState() != SearchState.CANCELED) {
                moveTo(session, SearchState.CANCELED, 0, null, clock.instant());
            }
        }
        log.info("Search canceled for request {}", requestId);
    }

    /** The request left SEARCHING (a provider accepted); the session is dropped silently. */
    public void discard(UUID requestId) {
        SearchSession session = sessions.remove(requestId);
        if (session != null) {
            synchronized (session) {
                session.close();
            }
        }
    }

    public Optional<SearchSession> findSession(UUID requestId) {
        return Optional.ofNullable(sessions.get(requestId));
    }

    /** A provider may accept only if this session actually offered the request to it. */
    public boolean wasOffered(UUID requestId, String providerId) {
        SearchSession session = sessions.get(requestId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            return session.hasOffered(providerId);
        }
    }

    /** True while a session is still looking; false once it timed out or there is none. */
    public boolean isSearchActive(UUID requestId) {
        SearchSession session = sessions.get(requestId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            return !session.isClosed() && !session.getState().isFinal();
        }
    }

    int activeSessionCount() {
        return sessions.size();
    }

    // --- session steps, always under the session monitor ---

    private void runFirstQuery(SearchSession session) {
        synchronized (session) {
            if (session.isFrozen() || session.getState() != SearchState.IDLE) {
                return;
            }
            Instant now = clock.instant();
            moveTo(session, SearchState.SEARCHING, 0, null, now);
            searchCurrentRadius(session, now);
        }
    }

    private void advance(SearchSession session, Instant now) {
        switch (session.getState()) {
            case SEARCHING, PROVIDER_FOUND -> {
                if (session.getDwellDeadline() != null && !now.isBefore(session.getDwellDeadline())) {
                    int lapsed = session.lapseOffers();
                    if (lapsed > 0) {
                        metrics.recordOffersLapsed(lapsed);
                    }
                    session.coolDownUntil(now.plus(properties.getCooldown()));
                    moveTo(session, SearchState.WAITING_COOLDOWN, 0, null, now);
                }
            }
            case WAITING_COOLDOWN -> {
                if (!now.isBefore(session.getCooldownDeadline())) {
                    if (session.isRetryCurrentRadius()) {
                        session.retryCurrentRadius(false);
                        moveTo(session, SearchState.SEARCHING, 0, null, now);
                        searchCurrentRadius(session, now);
                    } else {
                        moveTo(session, SearchState.EXPANDING_RADIUS, 0, null, now);
                        expandToNextRadius(session, now);
                    }
                }
            }
            default -> {
                // IDLE waits for the first query; TIMEOUT and CANCELED are final.
            }
        }
    }

    private void expandToNextRadius(SearchSession session, Instant now) {
        if (!session.advanceRadius()) {
            moveTo(session, SearchState.TIMEOUT, 0, null, now);
            metrics.recordSearchExhausted();
            log.warn("Search exhausted for request {} at {} km", session.getRequestId(), session.currentRadiusKm());
            return;
        }
        metrics.recordRadiusExpansion();
        log.info("Search for request {} expanding to {} km", session.getRequestId(), session.currentRadiusKm());
        searchCurrentRadius(session, now);
    }

    private void searchCurrentRadius(SearchSession session, Instant now) {
        List<ProviderCandidate> found = queryCurrentRadius(session, now);
        if (found == null) {
            return;
        }
        if (!found.isEmpty()) {
            providersFound(session, found, now);
        } else {
            session.dwellUntil(now.plus(properties.getDwell()));
            moveTo(session, SearchState.SEARCHING, 0, null, now);
        }
    }

    /** Null when the index was unreachable; the session is then parked to retry the same radius. */
    private List<ProviderCandidate> queryCurrentRadius(SearchSession session, Instant now) {
        Set<String> excluded = session.excludedProviderIds();
        try {
            return geoIndex.query(session.getServiceType(), session.getOrigin(), session.currentRadiusKm(), excluded)
                    .stream()
                    .filter(c -> !excluded.contains(c.getProviderId()))
                    .toList();
        } catch (ExternalUnavailableException e) {
            metrics.recordGeoIndexFailure();
            log.error("GeoIndex query failed for request {} at {} km: {}",
                    session.getRequestId(), session.currentRadiusKm(), e.getMessage());
            session.retryCurrentRadius(true);
            session.coolDownUntil(now.plus(properties.getCooldown()));
            moveTo(session, SearchState.WAITING_COOLDOWN, 0, e.getCode(), now);
            return null;
        }
    }

    private void providersFound(SearchSession session, List<ProviderCandidate> found, Instant now) {
        List<ProviderCandidate> fresh = session.recordOffers(found);
        session.dwellUntil(now.plus(properties.getDwell()));
        moveTo(session, SearchState.PROVIDER_FOUND, found.size(), null, now);
        if (!fresh.isEmpty()) {
            eventPublisher.publishOffer(session, fresh, now);
            metrics.recordOffersBroadcast(fresh.size());
        }
        log.info("Request {}: {} provider(s) at {} km ({} new)",
                session.getRequestId(), found.size(), session.currentRadiusKm(), fresh.size());
    }

    private void moveTo(SearchSession session, SearchState next, int candidateCount, String error, Instant now) {
        SearchState previous = session.moveTo(next);
        if (previous != next || error != null || next == SearchState.PROVIDER_FOUND) {
            eventPublisher.publishSearchProgress(session, previous, candidateCount, error, now);
        }
    }
}
