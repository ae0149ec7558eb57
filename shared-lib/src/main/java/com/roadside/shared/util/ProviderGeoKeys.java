package com.roadside.shared.util;

/**
 * Redis layout for provider presence, shared by the writer (location service)
 * and the reader (request-service GeoIndex).
 *
 *   providers:geo          GEO set, member = providerId
 *   provider:{providerId}  hash: online, services (comma separated), radarRangeKm, lat, lng, lastSeen
 */
public final class ProviderGeoKeys {

    private ProviderGeoKeys() {}

    public static final String GEO_KEY = "providers:geo";
    public static final String HASH_PREFIX = "provider:";

    public static final String FIELD_ONLINE = "online";
    public static final String FIELD_SERVICES = "services";
    public static final String FIELD_RADAR_RANGE_KM = "radarRangeKm";
    public static final String FIELD_LAT = "lat";
    public static final String FIELD_LNG = "lng";
    public static final String FIELD_LAST_SEEN = "lastSeen";

    public static String hashKey(String providerId) {
        return HASH_PREFIX + providerId;
    }
}
