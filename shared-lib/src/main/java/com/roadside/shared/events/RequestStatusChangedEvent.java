package com.roadside.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.roadside.shared.enums.PaymentStatus;
import com.roadside.shared.enums.RequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Broadcast for every status transition and every sub-state change worth showing
 * to either party. Delivery is at-least-once; consumers dedupe on
 * ({@code requestId}, {@code updatedAt}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestStatusChangedEvent {

    public static final String REASON_PROPOSAL = "PROPOSAL";
    public static final String REASON_VALUE_ACCEPTED = "VALUE_ACCEPTED";
    public static final String REASON_PAYMENT_FAILED = "PAYMENT_FAILED";
    public static final String REASON_PAYMENT_CONFIRMING = "PAYMENT_CONFIRMING";
    public static final String REASON_PROVIDER_WITHDREW = "PROVIDER_WITHDREW";
    public static final String REASON_OFFER_DECLINED = "OFFER_DECLINED";
    public static final String REASON_SEARCH_RETRY = "SEARCH_RETRY";
    public static final String REASON_AUTO_FINISHED = "AUTO_FINISHED";

    private String requestId;
    private String clientId;
    private String providerId;
    private RequestStatus status;
    private RequestStatus previousStatus;
    private PaymentStatus paymentStatus;
    private BigDecimal proposedValue;
    private BigDecimal agreedValue;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;

    @JsonIgnore
    public boolean isTransition() {
        return previousStatus != null && previousStatus != status;
    }
}
