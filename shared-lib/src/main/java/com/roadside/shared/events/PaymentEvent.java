package com.roadside.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEvent {

    private String attemptId;
    private String requestId;
    private String clientId;
    private String providerId;
    private BigDecimal amount;
    private String currency;
    private PaymentMethod paymentMethod;
    private String intentId;
    private PaymentStatus status;
    private String confirmedVia;
    private String failureReason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
