package com.roadside.request.matching;

import com.roadside.request.entity.GeoLocation;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.geo.ProviderCandidate;
import com.roadside.shared.enums.SearchState;
import com.roadside.shared.enums.ServiceType;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Progressive search for one request. Owned by {@link MatchingEngine}; every
 * mutation happens while the engine holds this object's monitor.
 *
 * Exclusions are the request's own set (declines, withdrawals) mirrored in,
 * plus providers whose offer lapsed in this session. A retry starts a new
 * session and so forgets the lapsed ones, never the request's.
 */
@Getter
public class SearchSession {

    private final UUID requestId;
    private final String clientId;
    private final ServiceType serviceType;
    private final GeoLocation origin;
    private final List<Double> radiusLadder;
    private final Instant startedAt;

    @Getter(AccessLevel.NONE)
    private final Set<String> requestExclusions = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> lapsedProviderIds = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> offeredProviderIds = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> everOffered = new LinkedHashSet<>();

    private int currentIndex;
    private SearchState state = SearchState.IDLE;
    private Instant dwellDeadline;
    private Instant cooldownDeadline;
    private boolean retryCurrentRadius;
    private boolean closed;
    /** An accept or cancel is being committed; nothing may be queried or offered meanwhile. */
    private boolean held;

    SearchSession(ServiceRequest request, List<Double> radiusLadder, Instant now) {
        this.requestId = request.getId();
        this.clientId = request.getClientId();
        this.serviceType = request.getServiceType();
        this.origin = request.getOrigin();
        this.radiusLadder = List.copyOf(radiusLadder);
        this.startedAt = now;
        this.requestExclusions.addAll(request.getExcludedProviderIds());
    }

    public double currentRadiusKm() {
        return radiusLadder.get(Math.min(currentIndex, radiusLadder.size() - 1));
    }

    public Set<String> excludedProviderIds() {
        Set<String> all = new LinkedHashSet<>(requestExclusions);
        all.addAll(lapsedProviderIds);
        return Collections.unmodifiableSet(all);
    }

    public Set<String> getOfferedProviderIds() {
        return Collections.unmodifiableSet(offeredProviderIds);
    }

    public boolean hasOffered(String providerId) {
        return everOffered.contains(providerId);
    }

    SearchState moveTo(SearchState next) {
        SearchState previous = state;
        state = next;
        return previous;
    }

    void mirrorExclusions(Set<String> exclusions) {
        requestExclusions.addAll(exclusions);
        offeredProviderIds.removeAll(exclusions);
    }

    boolean advanceRadius() {
        if (currentIndex + 1 >= radiusLadder.size()) {
            return false;
        }
        currentIndex++;
        return true;
    }

    /** Returns the candidates that had not been offered yet. */
    List<ProviderCandidate> recordOffers(List<ProviderCandidate> candidates) {
        List<ProviderCandidate> fresh = new ArrayList<>();
        for (ProviderCandidate candidate : candidates) {
            offeredProviderIds.add(candidate.getProviderId());
            if (everOffered.add(candidate.getProviderId())) {
                fresh.add(candidate);
            }
        }
        return fresh;
    }

    int lapseOffers() {
        int lapsed = offeredProviderIds.size();
        lapsedProviderIds.addAll(offeredProviderIds);
        offeredProviderIds.clear();
        return lapsed;
    }

    void dwellUntil(Instant deadline) {
        this.dwellDeadline = deadline;
    }

    void coolDownUntil(Instant deadline) {
        this.cooldownDeadline = deadline;
    }

    void retryCurrentRadius(boolean retry) {
        this.retryCurrentRadius = retry;
    }

    void close() {
        this.closed = true;
    }

    void hold(boolean held) {
        this.held = held;
    }

    /** Closed or held: the session must not query, offer or expand. */
    boolean isFrozen() {
        return closed || held;
    }
}
