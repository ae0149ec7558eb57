package com.roadside.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String REQUEST_STATUS_CHANGED    = "request.status.changed";
    public static final String REQUEST_SEARCH_PROGRESS   = "request.search.progress";
    public static final String PROVIDER_OFFER_SENT       = "provider.offer.sent";
    public static final String PAYMENT_CONFIRMED         = "payment.confirmed";
    public static final String PAYMENT_FAILED            = "payment.failed";
    public static final String PROVIDER_LOCATION_UPDATED = "provider.location.updated";
}
