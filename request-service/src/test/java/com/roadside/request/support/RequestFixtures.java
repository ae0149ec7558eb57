package com.roadside.request.support;

import com.roadside.request.entity.GeoLocation;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.ServiceType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Requests parked in a given lifecycle stage, with no pending changes. */
public final class RequestFixtures {

    public static final String CLIENT = "cli_001";
    public static final String PROVIDER = "prv_001";
    public static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private RequestFixtures() {
    }

    public static GeoLocation origin() {
        return new GeoLocation(-23.5505, -46.6333, "Av. Paulista, 1000 - São Paulo");
    }

    public static ServiceRequest searching() {
        ServiceRequest request = ServiceRequest.open(UUID.randomUUID(), CLIENT, ServiceType.TIRE,
                origin(), null, "Fiat Uno 2015 - ABC1D23", null, T0);
        request.transitionTo(RequestStatus.SEARCHING, null, T0);
        request.drainChanges();
        return request;
    }

    public static ServiceRequest accepted() {
        ServiceRequest request = searching();
        request.acceptBy(PROVIDER, T0);
        request.drainChanges();
        return request;
    }

    public static ServiceRequest valueAgreed(BigDecimal value, boolean directPayment) {
        ServiceRequest request = accepted();
        request.transitionTo(RequestStatus.NEGOTIATING, null, T0);
        request.recordProposal(value, Party.PROVIDER, null, T0);
        request.freezeAgreedValue(null, T0);
        if (directPayment) {
            request.markDirectPayment(true, null, T0);
        }
        request.drainChanges();
        return request;
    }

    public static ServiceRequest awaitingPayment(BigDecimal value, boolean directPayment) {
        ServiceRequest request = valueAgreed(value, directPayment);
        request.transitionTo(RequestStatus.AWAITING_PAYMENT, null, T0);
        request.drainChanges();
        return request;
    }
}
