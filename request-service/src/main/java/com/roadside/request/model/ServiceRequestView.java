package com.roadside.request.model;

import com.roadside.request.entity.GeoLocation;
import com.roadside.request.negotiation.NegotiationState;
import com.roadside.shared.enums.CancelReasonCategory;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.SearchState;
import com.roadside.shared.enums.ServiceType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
public class ServiceRequestView {
    private UUID requestId;
    private String clientId;
    private String providerId;
    private ServiceType serviceType;
    private boolean requiresDestination;
    private GeoLocation origin;
    private GeoLocation destination;
    private String vehicleInfo;
    private RequestStatus status;
    private NegotiationState negotiation;
    private PaymentMethod paymentMethod;
    private PaymentStatus paymentStatus;
    private boolean paymentConfirmed;
    private Set<String> excludedProviderIds;
    private SearchState searchState;
    private Double searchRadiusKm;
    private CancelReasonCategory cancelReasonCategory;
    private String cancelReasonText;
    private Party canceledBy;
    private String autoFinishReason;
    private Instant createdAt;
    private Instant updatedAt;
}
