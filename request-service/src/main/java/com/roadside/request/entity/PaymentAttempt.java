package com.roadside.request.entity;

import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One call to beginPayment. Every attempt opens its own gateway intent, so
 * retrying after a failure never reuses a charge.
 */
@Entity
@Table(name = "payment_attempts",
        indexes = {
                @Index(name = "idx_attempt_request", columnList = "request_id"),
                @Index(name = "idx_attempt_intent", columnList = "gateway_intent_id", unique = true),
                @Index(name = "idx_attempt_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class PaymentAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false)
    private PaymentMethod method;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "gateway_intent_id")
    private String gatewayIntentId;

    @Column(name = "checkout_url", length = 1000)
    private String checkoutUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private PaymentStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    /** SYNC, PUSH, POLL, DIRECT or RECONCILIATION. */
    @Column(name = "confirmed_via")
    private String confirmedVia;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isOpen() {
        return status == PaymentStatus.PENDING || status == PaymentStatus.CONFIRMING;
    }
}
