package com.roadside.location.service;

import com.roadside.location.model.LocationUpdateRequest;
import com.roadside.shared.enums.ServiceType;
import com.roadside.shared.events.ProviderLocationUpdatedEvent;
import com.roadside.shared.util.KafkaTopics;
import com.roadside.shared.util.ProviderGeoKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.core.GeoOperations;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderLocationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private GeoOperations<String, String> geoOperations;
    @Mock private HashOperations<String, Object, Object> hashOperations;
    @Mock private ZSetOperations<String, String> zSetOperations;
    @Mock private KafkaTemplate<String, Object> kafkaTemplate;

    private ProviderLocationService service;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForGeo()).thenReturn(geoOperations);
        lenient().when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        service = new ProviderLocationService(redisTemplate, kafkaTemplate,
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));
    }

    private static LocationUpdateRequest update(boolean online) {
        LocationUpdateRequest req = new LocationUpdateRequest();
        req.setProviderId("prv_001");
        req.setLatitude(-23.5505);
        req.setLongitude(-46.6333);
        req.setServices(new LinkedHashSet<>(List.of(ServiceType.TOWING, ServiceType.MECHANICAL)));
        req.setRadarRangeKm(12.0);
        req.setOnline(online);
        return req;
    }

    @Test
    @DisplayName("Heartbeat writes GEO member and metadata hash with TTL, then publishes on the tracking feed")
    @SuppressWarnings("unchecked")
    void heartbeatWritesIndex() {
        service.updateLocation(update(true));

        verify(geoOperations).add(ProviderGeoKeys.GEO_KEY, new Point(-46.6333, -23.5505), "prv_001");
        ArgumentCaptor<Map<String, String>> meta = ArgumentCaptor.forClass(Map.class);
        verify(hashOperations).putAll(eq(ProviderGeoKeys.hashKey("prv_001")), meta.capture());
        assertThat(meta.getValue())
                .containsEntry(ProviderGeoKeys.FIELD_ONLINE, "true")
                .containsEntry(ProviderGeoKeys.FIELD_SERVICES, "MECHANICAL,TOWING")
                .containsEntry(ProviderGeoKeys.FIELD_RADAR_RANGE_KM, "12.0")
                .containsEntry(ProviderGeoKeys.FIELD_LAST_SEEN, NOW.toString());
        verify(redisTemplate).expire(ProviderGeoKeys.hashKey("prv_001"), Duration.ofSeconds(30));

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(KafkaTopics.PROVIDER_LOCATION_UPDATED), eq("prv_001"), event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(ProviderLocationUpdatedEvent.class, e -> {
            assertThat(e.isOnline()).isTrue();
            assertThat(e.getTimestamp()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("Going offline removes the provider from the GEO set immediately")
    void offlineRemovesMember() {
        when(hashOperations.entries(ProviderGeoKeys.hashKey("prv_001")))
                .thenReturn(Map.<Object, Object>of(ProviderGeoKeys.FIELD_LAT, "-23.5505", ProviderGeoKeys.FIELD_LNG, "-46.6333"));

        service.updateLocation(update(false));

        verify(geoOperations).remove(ProviderGeoKeys.GEO_KEY, "prv_001");
        verify(hashOperations).put(ProviderGeoKeys.hashKey("prv_001"), ProviderGeoKeys.FIELD_ONLINE, "false");
        verify(geoOperations, never()).add(anyString(), any(Point.class), anyString());
        verify(hashOperations, never()).putAll(anyString(), anyMap());
    }

    @Test
    @DisplayName("Prune drops members whose heartbeat hash has expired")
    void pruneStaleMembers() {
        when(zSetOperations.range(ProviderGeoKeys.GEO_KEY, 0, -1)).thenReturn(Set.of("prv_alive", "prv_gone"));
        when(redisTemplate.hasKey(ProviderGeoKeys.hashKey("prv_alive"))).thenReturn(true);
        when(redisTemplate.hasKey(ProviderGeoKeys.hashKey("prv_gone"))).thenReturn(false);

        service.pruneStaleMembers();

        verify(geoOperations).remove(ProviderGeoKeys.GEO_KEY, "prv_gone");
        verify(geoOperations, never()).remove(ProviderGeoKeys.GEO_KEY, "prv_alive");
    }
}
