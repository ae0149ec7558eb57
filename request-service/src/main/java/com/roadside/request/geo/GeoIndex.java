package com.roadside.request.geo;

import com.roadside.request.entity.GeoLocation;
import com.roadside.shared.enums.ServiceType;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of provider presence: which online providers offering a
 * service are within a radius of a point.
 */
public interface GeoIndex {

    /**
     * @throws com.roadside.request.exception.ExternalUnavailableException when the backing store is unreachable
     */
    List<ProviderCandidate> query(ServiceType serviceType, GeoLocation origin, double radiusKm, Set<String> excluding);
}
