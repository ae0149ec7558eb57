package com.roadside.request.entity;

import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.InvalidValueException;
import com.roadside.request.support.RequestFixtures;
import com.roadside.shared.enums.CancelReasonCategory;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.ServiceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.roadside.request.support.RequestFixtures.CLIENT;
import static com.roadside.request.support.RequestFixtures.PROVIDER;
import static com.roadside.request.support.RequestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRequestTest {

    @Test
    @DisplayName("Opening validates origin and destination against the service type")
    void openValidatesLocations() {
        GeoLocation blankAddress = new GeoLocation(-23.55, -46.63, " ");
        GeoLocation outOfRange = new GeoLocation(95.0, -46.63, "North of everything");

        assertThatThrownBy(() -> ServiceRequest.open(UUID.randomUUID(), CLIENT, ServiceType.TIRE,
                blankAddress, null, null, null, T0)).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> ServiceRequest.open(UUID.randomUUID(), CLIENT, ServiceType.TOWING,
                RequestFixtures.origin(), outOfRange, null, null, T0)).isInstanceOf(InvalidValueException.class);

        ServiceRequest towing = ServiceRequest.open(UUID.randomUUID(), CLIENT, ServiceType.TOWING,
                RequestFixtures.origin(), new GeoLocation(-23.56, -46.64, "Oficina"), null, null, T0);
        assertThat(towing.getStatus()).isEqualTo(RequestStatus.IDLE);
        assertThat(towing.requiresDestination()).isTrue();
    }

    @Test
    @DisplayName("Edges outside the lifecycle graph are refused and leave the request unchanged")
    void illegalEdgeRefused() {
        ServiceRequest request = RequestFixtures.searching();

        assertThatThrownBy(() -> request.transitionTo(RequestStatus.IN_SERVICE, null, T0.plusSeconds(1)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.SEARCHING);
        assertThat(request.hasPendingChanges()).isFalse();
    }

    @Test
    @DisplayName("Engaged statuses need a provider")
    void engagedStatusNeedsProvider() {
        ServiceRequest request = RequestFixtures.searching();

        assertThatThrownBy(() -> request.transitionTo(RequestStatus.ACCEPTED, null, T0))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("updatedAt strictly increases even when changes share the same instant")
    void updatedAtStrictlyIncreases() {
        ServiceRequest request = RequestFixtures.searching();
        Instant same = T0.plusSeconds(10);

        request.acceptBy(PROVIDER, same);
        request.transitionTo(RequestStatus.NEGOTIATING, null, same);
        request.recordProposal(new BigDecimal("100.00"), Party.CLIENT, null, same);

        List<RequestChange> changes = request.drainChanges();
        assertThat(changes).hasSize(3);
        assertThat(changes.get(1).at()).isAfter(changes.get(0).at());
        assertThat(changes.get(2).at()).isAfter(changes.get(1).at());
        assertThat(request.getUpdatedAt()).isEqualTo(changes.get(2).at());
    }

    @Test
    @DisplayName("Excluded providers cannot accept and exclusions survive a withdrawal")
    void exclusionsOnlyGrow() {
        ServiceRequest request = RequestFixtures.accepted();

        String released = request.releaseProvider("PROVIDER_WITHDREW", T0.plusSeconds(5));
        request.excludeProvider("prv_009", "OFFER_DECLINED", T0.plusSeconds(6));

        assertThat(released).isEqualTo(PROVIDER);
        assertThat(request.getExcludedProviderIds()).containsExactlyInAnyOrder(PROVIDER, "prv_009");
        assertThat(request.excludeProvider(PROVIDER, "OFFER_DECLINED", T0.plusSeconds(7))).isFalse();
        assertThatThrownBy(() -> request.acceptBy(PROVIDER, T0.plusSeconds(8)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> request.getExcludedProviderIds().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Cancel records who and why; terminal requests cannot be canceled")
    void cancel() {
        ServiceRequest request = RequestFixtures.accepted();

        request.cancel(Party.PROVIDER, CancelReasonCategory.VEHICLE_ISSUE, "engine overheated", T0.plusSeconds(30));

        assertThat(request.getStatus()).isEqualTo(RequestStatus.CANCELED);
        assertThat(request.getCanceledBy()).isEqualTo(Party.PROVIDER);
        assertThat(request.getCanceledAt()).isEqualTo(request.getUpdatedAt());
        assertThatThrownBy(() -> request.cancel(Party.CLIENT, CancelReasonCategory.OTHER, null, T0.plusSeconds(31)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Completion round trip: request, dispute, request again, finish")
    void completionDispute() {
        ServiceRequest request = RequestFixtures.awaitingPayment(new BigDecimal("90.00"), false);
        request.confirmPayment(null, T0.plusSeconds(1));

        request.requestCompletion(T0.plusSeconds(60));
        assertThat(request.getProviderFinishRequestedAt()).isNotNull();
        request.disputeCompletion("COMPLETION_DISPUTED", T0.plusSeconds(90));
        assertThat(request.getStatus()).isEqualTo(RequestStatus.IN_SERVICE);
        assertThat(request.getProviderFinishRequestedAt()).isNull();
        request.requestCompletion(T0.plusSeconds(120));
        request.finish(null, T0.plusSeconds(150));

        assertThat(request.getStatus()).isEqualTo(RequestStatus.FINISHED);
        assertThat(request.getFinishedAt()).isEqualTo(T0.plusSeconds(150));
        assertThat(request.getAutoFinishReason()).isNull();
    }
}
