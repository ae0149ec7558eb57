package com.roadside.request.geo;

import com.roadside.request.entity.GeoLocation;
import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.repository.ServiceRequestRepository;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.ServiceType;
import com.roadside.shared.util.ProviderGeoKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GeoIndex over the Redis GEO set maintained by provider-location-service.
 *
 * A provider is eligible when it is online, offers the service, has the
 * origin inside its own radar range (if it set one) and is not engaged in
 * another active request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisGeoIndex implements GeoIndex {

    private static final int MAX_RESULTS = 50;

    private final RedisTemplate<String, String> redisTemplate;
    private final ServiceRequestRepository requestRepository;

    @Override
    public List<ProviderCandidate> query(ServiceType serviceType, GeoLocation origin,
                                         double radiusKm, Set<String> excluding) {
        Circle circle = new Circle(
                new Point(origin.getLongitude(), origin.getLatitude()),
                new Distance(radiusKm, Metrics.KILOMETERS)
        );

        try {
            GeoResults<RedisGeoCommands.GeoLocation<String>> geoResults = redisTemplate.opsForGeo().radius(
                    ProviderGeoKeys.GEO_KEY,
                    circle,
                    RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                            .includeDistance()
                            .includeCoordinates()
                            .sortAscending()
                            .limit(MAX_RESULTS)
            );

            if (geoResults == null) {
                return List.of();
            }

            List<ProviderCandidate> candidates = new ArrayList<>();
            for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : geoResults.getContent()) {
                String providerId = result.getContent().getName();
                if (excluding.contains(providerId)) continue;

                Map<Object, Object> meta = redisTemplate.opsForHash().entries(ProviderGeoKeys.hashKey(providerId));
                if (meta.isEmpty()) continue;

                double distanceKm = result.getDistance().getValue();
                if (!isEligible(meta, serviceType, distanceKm)) continue;
                if (requestRepository.existsByProviderIdAndStatusIn(providerId, RequestStatus.engagedStatuses())) continue;

                Point point = result.getContent().getPoint();
                candidates.add(ProviderCandidate.builder()
                        .providerId(providerId)
                        .latitude(point != null ? point.getY() : parseDouble(meta.get(ProviderGeoKeys.FIELD_LAT), 0.0))
                        .longitude(point != null ? point.getX() : parseDouble(meta.get(ProviderGeoKeys.FIELD_LNG), 0.0))
                        .distanceKm(distanceKm)
                        .build());
            }

            log.debug("GeoIndex: {} eligible {} provider(s) within {}km of ({},{})",
                    candidates.size(), serviceType, radiusKm, origin.getLatitude(), origin.getLongitude());
            return candidates;

        } catch (DataAccessException e) {
            throw new ExternalUnavailableException("Provider index unavailable: " + e.getMessage(), e);
        }
    }

    boolean isEligible(Map<Object, Object> meta, ServiceType serviceType, double distanceKm) {
        if (!Boolean.parseBoolean(String.valueOf(meta.get(ProviderGeoKeys.FIELD_ONLINE)))) {
            return false;
        }
        Object services = meta.get(ProviderGeoKeys.FIELD_SERVICES);
        if (services == null || Arrays.stream(services.toString().split(","))
                .map(String::trim)
                .noneMatch(serviceType.name()::equalsIgnoreCase)) {
            return false;
        }
        double radarRangeKm = parseDouble(meta.get(ProviderGeoKeys.FIELD_RADAR_RANGE_KM), 0.0);
        return radarRangeKm <= 0.0 || distanceKm <= radarRangeKm;
    }

    private double parseDouble(Object val, double defaultVal) {
        if (val == null) return defaultVal;
        try { return Double.parseDouble(val.toString()); }
        catch (NumberFormatException e) { return defaultVal; }
    }
}
