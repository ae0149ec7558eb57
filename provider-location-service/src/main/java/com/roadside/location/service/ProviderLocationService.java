package com.roadside.location.service;

import com.roadside.location.model.LocationUpdateRequest;
import com.roadside.shared.enums.ServiceType;
import com.roadside.shared.events.ProviderLocationUpdatedEvent;
import com.roadside.shared.util.KafkaTopics;
import com.roadside.shared.util.ProviderGeoKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writer side of the provider GeoIndex. The request service only ever reads
 * {@link ProviderGeoKeys#GEO_KEY} and the per-provider hashes written here.
 *
 * The hash expires when heartbeats stop; the GEO member does not expire on its
 * own, so {@link #pruneStaleMembers()} removes members whose hash is gone.
 */
@Slf4j
@Service
public class ProviderLocationService {

    private final RedisTemplate<String, String> redisTemplate;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;
    private final Duration heartbeatTtl;

    public ProviderLocationService(RedisTemplate<String, String> redisTemplate,
                                   KafkaTemplate<String, Object> kafkaTemplate,
                                   Clock clock,
                                   @Value("${location.heartbeat-ttl:30s}") Duration heartbeatTtl) {
        this.redisTemplate = redisTemplate;
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
        this.heartbeatTtl = heartbeatTtl;
    }

    public void updateLocation(LocationUpdateRequest req) {
        if (!req.isOnline()) {
            goOffline(req.getProviderId());
            return;
        }
        String providerId = req.getProviderId();
        Instant now = clock.instant();

        redisTemplate.opsForGeo().add(ProviderGeoKeys.GEO_KEY,
                new Point(req.getLongitude(), req.getLatitude()), providerId);

        String hashKey = ProviderGeoKeys.hashKey(providerId);
        Map<String, String> meta = new HashMap<>();
        meta.put(ProviderGeoKeys.FIELD_ONLINE, "true");
        meta.put(ProviderGeoKeys.FIELD_SERVICES, req.getServices().stream()
                .map(ServiceType::name)
                .sorted()
                .collect(Collectors.joining(",")));
        meta.put(ProviderGeoKeys.FIELD_RADAR_RANGE_KM,
                String.valueOf(req.getRadarRangeKm() != null ? req.getRadarRangeKm() : 0.0));
        meta.put(ProviderGeoKeys.FIELD_LAT, String.valueOf(req.getLatitude()));
        meta.put(ProviderGeoKeys.FIELD_LNG, String.valueOf(req.getLongitude()));
        meta.put(ProviderGeoKeys.FIELD_LAST_SEEN, now.toString());
        redisTemplate.opsForHash().putAll(hashKey, meta);
        redisTemplate.expire(hashKey, heartbeatTtl);

        publish(providerId, req.getLatitude(), req.getLongitude(), true, now);
        log.debug("Location updated for provider {} at ({},{})", providerId, req.getLatitude(), req.getLongitude());
    }

    /** Removes the provider from the GEO set at once; the hash stays for diagnostics until it expires. */
    public void goOffline(String providerId) {
        redisTemplate.opsForGeo().remove(ProviderGeoKeys.GEO_KEY, providerId);
        String hashKey = ProviderGeoKeys.hashKey(providerId);
        Map<Object, Object> meta = redisTemplate.opsForHash().entries(hashKey);
        if (!meta.isEmpty()) {
            redisTemplate.opsForHash().put(hashKey, ProviderGeoKeys.FIELD_ONLINE, "false");
        }
        publish(providerId, parseDouble(meta.get(ProviderGeoKeys.FIELD_LAT)),
                parseDouble(meta.get(ProviderGeoKeys.FIELD_LNG)), false, clock.instant());
        log.info("Provider {} went offline", providerId);
    }

    public Map<Object, Object> getProviderMeta(String providerId) {
        return redisTemplate.opsForHash().entries(ProviderGeoKeys.hashKey(providerId));
    }

    /** Drops GEO members whose heartbeat hash has expired. */
    @Scheduled(fixedDelayString = "${location.prune.interval-ms:30000}")
    public void pruneStaleMembers() {
        Set<String> members = redisTemplate.opsForZSet().range(ProviderGeoKeys.GEO_KEY, 0, -1);
        if (members == null || members.isEmpty()) return;

        int pruned = 0;
        for (String providerId : members) {
            if (!Boolean.TRUE.equals(redisTemplate.hasKey(ProviderGeoKeys.hashKey(providerId)))) {
                redisTemplate.opsForGeo().remove(ProviderGeoKeys.GEO_KEY, providerId);
                pruned++;
            }
        }
        if (pruned > 0) {
            log.info("Pruned {} provider(s) with no heartbeat in {}", pruned, heartbeatTtl);
        }
    }

    private void publish(String providerId, double lat, double lng, boolean online, Instant at) {
        ProviderLocationUpdatedEvent event = ProviderLocationUpdatedEvent.builder()
                .providerId(providerId)
                .latitude(lat)
                .longitude(lng)
                .online(online)
                .timestamp(at)
                .build();
        kafkaTemplate.send(KafkaTopics.PROVIDER_LOCATION_UPDATED, providerId, event);
    }

    private static double parseDouble(Object val) {
        if (val == null) return 0.0;
        try { return Double.parseDouble(val.toString()); }
        catch (NumberFormatException e) { return 0.0; }
    }
}
