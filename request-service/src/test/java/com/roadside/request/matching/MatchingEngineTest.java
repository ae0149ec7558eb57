package com.roadside.request.matching;

import com.roadside.request.config.MatchingProperties;
import com.roadside.request.entity.GeoLocation;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.geo.GeoIndex;
import com.roadside.request.geo.ProviderCandidate;
import com.roadside.request.metrics.LifecycleMetrics;
import com.roadside.request.service.RequestEventPublisher;
import com.roadside.request.support.MutableClock;
import com.roadside.request.support.RequestFixtures;
import com.roadside.shared.enums.SearchState;
import com.roadside.shared.enums.ServiceType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Progressive search over the ladder [5, 10, 15] km with a 6s dwell and 2s cooldown.
 *
 *   t0   query 5 km
 *   t6   dwell over  -> WAITING_COOLDOWN
 *   t8   cooldown over -> EXPANDING_RADIUS -> query 10 km
 *   ...
 *   t24  past 15 km -> TIMEOUT
 */
@ExtendWith(MockitoExtension.class)
class MatchingEngineTest {

    private static final Instant T0 = RequestFixtures.T0;

    @Mock private GeoIndex geoIndex;
    @Mock private RequestEventPublisher eventPublisher;
    @Captor private ArgumentCaptor<Set<String>> excludedCaptor;

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private MatchingProperties properties;
    private MatchingEngine engine;
    private ServiceRequest request;
    private final List<SearchState> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(T0);
        properties = new MatchingProperties();
        properties.setRadiusLadderKm(List.of(5.0, 10.0, 15.0));
        properties.setDwell(Duration.ofSeconds(6));
        properties.setCooldown(Duration.ofSeconds(2));
        engine = newEngine(Runnable::run);
        request = RequestFixtures.searching();

        lenient().doAnswer(inv -> {
            progress.add(inv.<SearchSession>getArgument(0).getState());
            return null;
        }).when(eventPublisher).publishSearchProgress(any(), any(), anyInt(), any(), any());
    }

    private MatchingEngine newEngine(Executor executor) {
        return new MatchingEngine(geoIndex, eventPublisher, properties,
                new LifecycleMetrics(registry), clock, executor);
    }

    private static ProviderCandidate candidate(String id, double distanceKm) {
        return ProviderCandidate.builder().providerId(id).latitude(-23.55).longitude(-46.63).distanceKm(distanceKm).build();
    }

    /** Answers each radius from a fixed table, honouring the exclusion set like the real index. */
    private void providersByRadius(Map<Double, List<ProviderCandidate>> table) {
        when(geoIndex.query(eq(ServiceType.TIRE), any(GeoLocation.class), anyDouble(), anySet())).thenAnswer(inv -> {
            double radius = inv.getArgument(2);
            Set<String> excluding = inv.getArgument(3);
            return table.getOrDefault(radius, List.of()).stream()
                    .filter(c -> !excluding.contains(c.getProviderId()))
                    .toList();
        });
    }

    private void tickAt(long secondsAfterStart) {
        engine.tick(T0.plusSeconds(secondsAfterStart));
    }

    // ─── expansion ───

    @Test
    @DisplayName("Nobody within 5 km: after dwell and cooldown the session expands and queries 10 km")
    void expandsAfterDwellAndCooldown() {
        providersByRadius(Map.of());

        SearchSession session = engine.startSearch(request);
        assertThat(session.getState()).isEqualTo(SearchState.SEARCHING);
        assertThat(session.currentRadiusKm()).isEqualTo(5.0);

        tickAt(3);
        assertThat(session.getState()).isEqualTo(SearchState.SEARCHING);

        tickAt(6);
        assertThat(session.getState()).isEqualTo(SearchState.WAITING_COOLDOWN);

        tickAt(8);
        verify(geoIndex).query(eq(ServiceType.TIRE), any(GeoLocation.class), eq(10.0), anySet());
        assertThat(session.currentRadiusKm()).isEqualTo(10.0);
        assertThat(progress).containsExactly(
                SearchState.SEARCHING, SearchState.WAITING_COOLDOWN, SearchState.EXPANDING_RADIUS, SearchState.SEARCHING);
        assertThat(registry.get("matching.radius.expansions").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Running past the last radius ends the session in TIMEOUT and stops querying")
    void timesOutAfterLastRadius() {
        providersByRadius(Map.of());
        SearchSession session = engine.startSearch(request);

        for (long t : new long[]{6, 8, 14, 16, 22, 24}) {
            tickAt(t);
        }

        assertThat(session.getState()).isEqualTo(SearchState.TIMEOUT);
        assertThat(engine.isSearchActive(request.getId())).isFalse();
        assertThat(registry.get("matching.search.exhausted").counter().count()).isEqualTo(1.0);

        tickAt(600);
        verify(geoIndex, times(3)).query(any(), any(), anyDouble(), anySet());
    }

    // ─── offers and declines ───

    @Test
    @DisplayName("Providers found: offers go out once per provider and the session is PROVIDER_FOUND")
    void providersFoundAreOffered() {
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2), candidate("p2", 3.4))));

        SearchSession session = engine.startSearch(request);

        assertThat(session.getState()).isEqualTo(SearchState.PROVIDER_FOUND);
        assertThat(engine.wasOffered(request.getId(), "p1")).isTrue();
        assertThat(engine.wasOffered(request.getId(), "p9")).isFalse();
        verify(eventPublisher).publishOffer(eq(session), anyList(), eq(T0));
        assertThat(registry.get("matching.offers").tag("outcome", "broadcast").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("A decline re-queries the same radius at once, without the decliner and without waiting for cooldown")
    void declineForcesImmediateRequery() {
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2), candidate("p2", 3.4))));
        SearchSession session = engine.startSearch(request);

        engine.forceExpand(request.getId(), Set.of("p1"));

        verify(geoIndex, times(2)).query(any(), any(), eq(5.0), excludedCaptor.capture());
        assertThat(excludedCaptor.getAllValues().get(1)).contains("p1");
        assertThat(session.excludedProviderIds()).contains("p1");
        assertThat(session.getOfferedProviderIds()).containsExactly("p2");
        assertThat(session.getState()).isEqualTo(SearchState.PROVIDER_FOUND);
        assertThat(session.currentRadiusKm()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("A decline that leaves nobody at this radius expands straight to the next one")
    void declineOfLastCandidateExpands() {
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2))));
        SearchSession session = engine.startSearch(request);

        engine.forceExpand(request.getId(), Set.of("p1"));

        assertThat(session.currentRadiusKm()).isEqualTo(10.0);
        assertThat(session.getState()).isEqualTo(SearchState.SEARCHING);
        verify(geoIndex).query(any(), any(), eq(10.0), excludedCaptor.capture());
        assertThat(excludedCaptor.getValue()).contains("p1");
    }

    @Test
    @DisplayName("Offers that lapse without an answer are skipped for the rest of the session, but a retry forgets them")
    void lapsedOffersExcludedUntilRetry() {
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2)), 10.0, List.of(candidate("p1", 1.2))));
        SearchSession first = engine.startSearch(request);

        tickAt(6);
        tickAt(8);

        assertThat(first.currentRadiusKm()).isEqualTo(10.0);
        assertThat(first.getState()).isEqualTo(SearchState.SEARCHING);
        assertThat(first.excludedProviderIds()).containsExactly("p1");
        assertThat(registry.get("matching.offers").tag("outcome", "lapsed").counter().count()).isEqualTo(1.0);

        SearchSession retried = engine.startSearch(request);

        assertThat(first.isClosed()).isTrue();
        assertThat(retried.excludedProviderIds()).isEmpty();
        assertThat(retried.getState()).isEqualTo(SearchState.PROVIDER_FOUND);
    }

    @Test
    @DisplayName("Exclusions recorded on the request are carried into every new session")
    void requestExclusionsCarriedIntoSession() {
        request.excludeProvider("p1", "test", T0);
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2), candidate("p2", 2.0))));

        SearchSession session = engine.startSearch(request);

        assertThat(session.getOfferedProviderIds()).containsExactly("p2");
        assertThat(engine.wasOffered(request.getId(), "p1")).isFalse();
    }

    @Test
    @DisplayName("A held session neither expands nor offers until it is released")
    void heldSessionIsFrozen() {
        providersByRadius(Map.of(5.0, List.of(candidate("p1", 1.2)), 10.0, List.of(candidate("p2", 4.0))));
        SearchSession session = engine.startSearch(request);
        verify(eventPublisher).publishOffer(any(), anyList(), any());

        engine.hold(request.getId());
        tickAt(6);
        tickAt(8);
        engine.forceExpand(request.getId(), Set.of("p1"));

        assertThat(session.isHeld()).isTrue();
        assertThat(session.getState()).isEqualTo(SearchState.PROVIDER_FOUND);
        assertThat(session.currentRadiusKm()).isEqualTo(5.0);
        verify(geoIndex, times(1)).query(any(), any(), anyDouble(), anySet());
        verify(eventPublisher, times(1)).publishOffer(any(), anyList(), any());

        engine.release(request.getId());
        tickAt(6);
        tickAt(8);

        assertThat(session.isHeld()).isFalse();
        assertThat(session.currentRadiusKm()).isEqualTo(10.0);
        verify(eventPublisher, times(2)).publishOffer(any(), anyList(), any());
    }

    // ─── cancel and failures ───

    @Test
    @DisplayName("Canceling before the first query runs means no query and no offer, ever")
    void cancelBeforeFirstQueryNeverResurrects() {
        List<Runnable> queued = new ArrayList<>();
        engine = newEngine(queued::add);

        SearchSession session = engine.startSearch(request);
        engine.cancel(request.getId());
        queued.forEach(Runnable::run);
        tickAt(600);

        assertThat(session.getState()).isEqualTo(SearchState.CANCELED);
        assertThat(engine.findSession(request.getId())).isEmpty();
        verify(geoIndex, never()).query(any(), any(), anyDouble(), anySet());
        verify(eventPublisher, never()).publishOffer(any(), anyList(), any());
    }

    @Test
    @DisplayName("Canceling mid-search stops further expansion")
    void cancelStopsExpansion() {
        providersByRadius(Map.of());
        SearchSession session = engine.startSearch(request);

        engine.cancel(request.getId());
        tickAt(6);
        tickAt(8);

        assertThat(session.getState()).isEqualTo(SearchState.CANCELED);
        assertThat(progress).endsWith(SearchState.CANCELED);
        verify(geoIndex, times(1)).query(any(), any(), anyDouble(), anySet());
    }

    @Test
    @DisplayName("An unreachable GeoIndex is reported and the same radius is retried after the cooldown")
    void geoIndexFailureRetriesSameRadius() {
        when(geoIndex.query(any(), any(), anyDouble(), anySet()))
                .thenThrow(new ExternalUnavailableException("redis down", null))
                .thenReturn(List.of(candidate("p1", 0.8)));

        SearchSession session = engine.startSearch(request);

        assertThat(session.getState()).isEqualTo(SearchState.WAITING_COOLDOWN);
        verify(eventPublisher).publishSearchProgress(eq(session), eq(SearchState.SEARCHING), eq(0),
                eq(ExternalUnavailableException.CODE), eq(T0));
        assertThat(registry.get("matching.geoindex.failures").counter().count()).isEqualTo(1.0);

        tickAt(2);

        verify(geoIndex, times(2)).query(any(), any(), eq(5.0), anySet());
        assertThat(session.getState()).isEqualTo(SearchState.PROVIDER_FOUND);
        assertThat(session.currentRadiusKm()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("A radius ladder that is not strictly ascending is rejected at startup")
    void ladderMustAscend() {
        properties.setRadiusLadderKm(List.of(5.0, 5.0, 10.0));

        assertThatThrownBy(() -> newEngine(Runnable::run))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
