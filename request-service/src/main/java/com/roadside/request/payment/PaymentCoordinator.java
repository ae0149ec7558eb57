package com.roadside.request.payment;

import com.roadside.request.config.PaymentProperties;
import com.roadside.request.entity.PaymentAttempt;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.ExternalUnavailableException;
import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.RequestException;
import com.roadside.request.metrics.LifecycleMetrics;
import com.roadside.request.model.PaymentHandle;
import com.roadside.request.repository.PaymentAttemptRepository;
import com.roadside.request.service.RequestEventPublisher;
import com.roadside.request.service.RequestStateMachine;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.events.RequestStatusChangedEvent;
import com.roadside.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Settlement of an agreed value, from AWAITING_PAYMENT to IN_SERVICE.
 *
 * <pre>
 *  beginPayment
 *    1. [lock]  validate, supersede open attempts, open attempt N (PENDING)
 *    2.         gateway.createIntent          (no lock held during the remote call)
 *    3. [lock]  PAID    -> confirm (SYNC)
 *               FAILED  -> attempt FAILED, request paymentStatus FAILED
 *               PENDING -> CONFIRMING, start bounded polling
 *
 *  webhook push ─┐
 *  poll result ──┼─> onGatewayStatus -> [lock] confirm / fail   (first one wins)
 *  provider ─────┘   (direct receipt)
 * </pre>
 *
 * Confirmation is idempotent: a second signal for the confirmed attempt
 * changes nothing. A capture reported for an attempt that was superseded by a
 * retry still settles the request if it is awaiting payment; money captured
 * after the request was settled or canceled marks the attempt REFUND_REQUIRED
 * and is published on the payment-failed topic. Running out of polling time is
 * not a failure; the attempt stays CONFIRMING until a push, a resumed poll or
 * reconciliation settles it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCoordinator {

    public static final String VIA_SYNC = "SYNC";
    public static final String VIA_PUSH = "PUSH";
    public static final String VIA_POLL = "POLL";
    public static final String VIA_DIRECT = "DIRECT";
    public static final String VIA_RECONCILIATION = "RECONCILIATION";

    static final String REASON_PAYMENT_STARTED = "PAYMENT_STARTED";
    static final String REASON_DUPLICATE_CAPTURE = "DUPLICATE_CAPTURE";
    static final String REASON_CAPTURED_AFTER_CANCEL = "CAPTURED_AFTER_CANCEL";
    static final String REASON_PAID_BY_OTHER_ATTEMPT = "PAID_BY_OTHER_ATTEMPT";

    private final RequestStateMachine stateMachine;
    private final PaymentAttemptRepository attemptRepository;
    private final PaymentGatewayClient gatewayClient;
    private final PaymentConfirmationPoller poller;
    private final RequestEventPublisher eventPublisher;
    private final PaymentProperties properties;
    private final LifecycleMetrics metrics;
    private final Clock clock;

    public PaymentHandle beginPayment(UUID requestId, String clientId, PaymentMethod method) {
        PaymentAttempt opened = stateMachine.mutate(requestId, request -> openAttempt(request, clientId, method));

        if (method.settlesOffPlatform()) {
            log.info("Request {}: direct payment of {} awaiting provider receipt", requestId, opened.getAmount());
            return handle(opened, PaymentHandle.Kind.DIRECT, false);
        }

        GatewayIntent intent;
        try {
            intent = gatewayClient.createIntent(requestId, method, opened.getAmount(), opened.getCurrency());
        } catch (ExternalUnavailableException e) {
            stateMachine.mutate(requestId, request -> {
                PaymentAttempt attempt = requireAttempt(opened.getId());
                return failInternal(request, attempt, "GATEWAY_UNAVAILABLE", clock.instant());
            });
            throw e;
        }

        PaymentHandle handle = stateMachine.mutate(requestId, request -> recordIntent(request, opened.getId(), intent));
        if (handle.getStatus() == PaymentStatus.CONFIRMING) {
            startPolling(requestId, intent.intentId());
        }
        return handle;
    }

    /** Push channel. Poll results and reconciliation go through the same path. */
    public boolean onGatewayStatus(UUID requestId, String intentId, GatewayStatus status, String failureReason, String via) {
        if (!status.isSettled()) {
            return false;
        }
        return stateMachine.mutate(requestId, request -> {
            PaymentAttempt attempt = attemptRepository.findByGatewayIntentId(intentId)
                    .filter(a -> a.getRequestId().equals(requestId))
                    .orElseThrow(() -> new RequestException(RequestException.PAYMENT_ATTEMPT_NOT_FOUND,
                            "No payment attempt with intent " + intentId + " on request " + requestId));
            Instant now = clock.instant();
            return status == GatewayStatus.PAID
                    ? confirmInternal(request, attempt, via, now)
                    : failInternal(request, attempt, failureReason != null ? failureReason : "GATEWAY_DECLINED", now);
        });
    }

    /** Re-opens bounded polling for an attempt still waiting on the gateway. */
    public PaymentHandle resumeConfirmation(UUID requestId, String clientId) {
        PaymentAttempt attempt = stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            if (request.getStatus() != RequestStatus.AWAITING_PAYMENT || request.isPaymentConfirmed()) {
                throw new InvalidTransitionException("Request " + requestId + " is not awaiting payment");
            }
            return latestOpenAttempt(requestId)
                    .filter(a -> a.getStatus() == PaymentStatus.CONFIRMING)
                    .orElseThrow(() -> new InvalidTransitionException(
                            "Request " + requestId + " has no payment waiting for confirmation"));
        });
        startPolling(requestId, attempt.getGatewayIntentId());
        return handle(attempt, PaymentHandle.Kind.CHECKOUT, false);
    }

    /** The provider received the agreed value outside the platform. */
    public PaymentHandle confirmDirectReceipt(UUID requestId, String providerId) {
        return stateMachine.mutate(requestId, request -> {
            request.requireParty(providerId, Party.PROVIDER);
            PaymentAttempt attempt = latestOpenAttempt(requestId)
                    .filter(a -> a.getMethod().settlesOffPlatform())
                    .orElseThrow(() -> new InvalidTransitionException(
                            "Request " + requestId + " has no direct payment to confirm"));
            confirmInternal(request, attempt, VIA_DIRECT, clock.instant());
            return handle(attempt, PaymentHandle.Kind.DIRECT, request.isPaymentConfirmed());
        });
    }

    /**
     * Attempts left CONFIRMING after polling gave up, or superseded while the
     * client was still paying. Returns true if the gateway now reports them
     * paid and the request was confirmed through them.
     */
    public boolean reconcile(PaymentAttempt attempt) {
        if (poller.isPolling(attempt.getRequestId())) {
            return false;
        }
        GatewayStatus status = gatewayClient.pollStatus(attempt.getGatewayIntentId());
        if (status != GatewayStatus.PAID) {
            return false;
        }
        return onGatewayStatus(attempt.getRequestId(), attempt.getGatewayIntentId(), status, null, VIA_RECONCILIATION);
    }

    /** Called under the request lock when the request is canceled. */
    public void abandonPayments(ServiceRequest request, Instant now) {
        stopPollingOnCommit(request.getId());
        for (PaymentAttempt attempt : attemptRepository.findByRequestIdOrderByAttemptNumberAsc(request.getId())) {
            if (attempt.isOpen()) {
                attempt.setStatus(PaymentStatus.SUPERSEDED);
                attempt.setFailureReason("REQUEST_CANCELED");
                attemptRepository.save(attempt);
                log.info("Request {}: payment attempt {} abandoned on cancel", request.getId(), attempt.getAttemptNumber());
            }
        }
    }

    // --- under the request lock ---

    private PaymentAttempt openAttempt(ServiceRequest request, String clientId, PaymentMethod method) {
        request.requireParty(clientId, Party.CLIENT);
        if (request.getStatus() != RequestStatus.AWAITING_PAYMENT || request.isPaymentConfirmed()) {
            throw new InvalidTransitionException("Request " + request.getId() + " is not awaiting payment");
        }
        if (method.settlesOffPlatform() && !request.isDirectPayment()) {
            throw new InvalidTransitionException("Direct payment was not agreed on request " + request.getId());
        }
        Instant now = clock.instant();
        List<PaymentAttempt> attempts = attemptRepository.findByRequestIdOrderByAttemptNumberAsc(request.getId());
        supersedeOpenAttempts(attempts, null);
        stopPollingOnCommit(request.getId());

        PaymentAttempt attempt = attemptRepository.save(PaymentAttempt.builder()
                .requestId(request.getId())
                .attemptNumber(attempts.size() + 1)
                .method(method)
                .amount(request.getAgreedValue())
                .currency(properties.getCurrency())
                .status(PaymentStatus.PENDING)
                .createdAt(now)
                .build());
        request.startPayment(method, REASON_PAYMENT_STARTED, now);
        log.info("Request {}: payment attempt {} opened ({}, {} {})", request.getId(), attempt.getAttemptNumber(),
                method, attempt.getAmount(), attempt.getCurrency());
        return attempt;
    }

    private PaymentHandle recordIntent(ServiceRequest request, UUID attemptId, GatewayIntent intent) {
        PaymentAttempt attempt = requireAttempt(attemptId);
        attempt.setGatewayIntentId(intent.intentId());
        attempt.setCheckoutUrl(intent.checkoutUrl());
        Instant now = clock.instant();
        if (attempt.getStatus() != PaymentStatus.PENDING) {
            // Superseded or abandoned while the gateway call was in flight.
            attemptRepository.save(attempt);
            log.warn("Request {}: intent {} arrived for closed attempt {} ({})", request.getId(),
                    intent.intentId(), attempt.getAttemptNumber(), attempt.getStatus());
            if (intent.status() == GatewayStatus.PAID) {
                confirmInternal(request, attempt, VIA_SYNC, now);
            }
            return handle(attempt, PaymentHandle.Kind.IMMEDIATE, request.isPaymentConfirmed());
        }
        switch (intent.status()) {
            case PAID -> {
                confirmInternal(request, attempt, VIA_SYNC, now);
                return handle(attempt, PaymentHandle.Kind.IMMEDIATE, request.isPaymentConfirmed());
            }
            case FAILED -> {
                failInternal(request, attempt, "GATEWAY_DECLINED", now);
                return handle(attempt, PaymentHandle.Kind.IMMEDIATE, false);
            }
            default -> {
                attempt.setStatus(PaymentStatus.CONFIRMING);
                attemptRepository.save(attempt);
                request.markPaymentStatus(PaymentStatus.CONFIRMING, RequestStatusChangedEvent.REASON_PAYMENT_CONFIRMING, now);
                return handle(attempt, PaymentHandle.Kind.CHECKOUT, false);
            }
        }
    }

    private boolean confirmInternal(ServiceRequest request, PaymentAttempt attempt, String via, Instant now) {
        if (attempt.getStatus() == PaymentStatus.CONFIRMED || attempt.getStatus() == PaymentStatus.REFUND_REQUIRED) {
            log.debug("Request {}: repeated {} confirmation for attempt {} ignored", request.getId(),
                    via.toLowerCase(Locale.ROOT), attempt.getAttemptNumber());
            return false;
        }
        if (request.getStatus() != RequestStatus.AWAITING_PAYMENT || request.isPaymentConfirmed()) {
            if (attempt.getMethod().settlesOffPlatform()) {
                log.warn("Request {}: direct receipt for attempt {} ignored, request is {}", request.getId(),
                        attempt.getAttemptNumber(), request.getStatus());
                return false;
            }
            requireRefund(request, attempt, via, now);
            return false;
        }
        if (!attempt.isOpen()) {
            // A retry superseded this intent but the client paid it anyway.
            log.warn("Request {}: {} capture on {} attempt {}, settling through it", request.getId(),
                    via.toLowerCase(Locale.ROOT), attempt.getStatus(), attempt.getAttemptNumber());
            supersedeOpenAttempts(attemptRepository.findByRequestIdOrderByAttemptNumberAsc(request.getId()),
                    REASON_PAID_BY_OTHER_ATTEMPT);
            attempt.setFailureReason(null);
        }
        attempt.setStatus(PaymentStatus.CONFIRMED);
        attempt.setConfirmedVia(via);
        attempt.setConfirmedAt(now);
        attemptRepository.save(attempt);
        request.confirmPayment(null, now);
        stopPollingOnCommit(request.getId());
        eventPublisher.publishPayment(request, attempt, KafkaTopics.PAYMENT_CONFIRMED, now);
        metrics.recordPaymentConfirmed(via);
        log.info("Request {}: payment confirmed via {} (attempt {}, {} {})", request.getId(), via,
                attempt.getAttemptNumber(), attempt.getAmount(), attempt.getCurrency());
        return true;
    }

    /** Money the gateway captured that no longer pays for anything. */
    private void requireRefund(ServiceRequest request, PaymentAttempt attempt, String via, Instant now) {
        String reason = request.getStatus() == RequestStatus.CANCELED
                ? REASON_CAPTURED_AFTER_CANCEL : REASON_DUPLICATE_CAPTURE;
        attempt.setStatus(PaymentStatus.REFUND_REQUIRED);
        attempt.setFailureReason(reason);
        attempt.setConfirmedVia(via);
        attempt.setConfirmedAt(now);
        attemptRepository.save(attempt);
        eventPublisher.publishPayment(request, attempt, KafkaTopics.PAYMENT_FAILED, now);
        metrics.recordRefundRequired();
        log.error("Request {}: attempt {} captured {} {} via {} while request is {}{}, refund required ({})",
                request.getId(), attempt.getAttemptNumber(), attempt.getAmount(), attempt.getCurrency(),
                via.toLowerCase(Locale.ROOT), request.getStatus(),
                request.isPaymentConfirmed() ? " (already paid)" : "", reason);
    }

    private void supersedeOpenAttempts(List<PaymentAttempt> attempts, String reason) {
        for (PaymentAttempt open : attempts) {
            if (open.isOpen()) {
                open.setStatus(PaymentStatus.SUPERSEDED);
                open.setFailureReason(reason);
                attemptRepository.save(open);
            }
        }
    }

    private boolean failInternal(ServiceRequest request, PaymentAttempt attempt, String reason, Instant now) {
        if (!attempt.isOpen()) {
            return false;
        }
        attempt.setStatus(PaymentStatus.FAILED);
        attempt.setFailureReason(reason);
        attemptRepository.save(attempt);
        stopPollingOnCommit(request.getId());
        if (request.getStatus() == RequestStatus.AWAITING_PAYMENT && !request.isPaymentConfirmed()) {
            request.markPaymentStatus(PaymentStatus.FAILED, RequestStatusChangedEvent.REASON_PAYMENT_FAILED, now);
        }
        eventPublisher.publishPayment(request, attempt, KafkaTopics.PAYMENT_FAILED, now);
        metrics.recordPaymentFailed();
        log.warn("Request {}: payment attempt {} failed: {}", request.getId(), attempt.getAttemptNumber(), reason);
        return true;
    }

    private void startPolling(UUID requestId, String intentId) {
        poller.start(requestId, intentId, new PaymentConfirmationPoller.Listener() {
            @Override
            public void onSettled(GatewayStatus status) {
                onGatewayStatus(requestId, intentId, status, "GATEWAY_REPORTED_FAILURE", VIA_POLL);
            }

            @Override
            public void onCeilingReached() {
                metrics.recordPollCeiling();
            }
        });
    }

    private void stopPollingOnCommit(UUID requestId) {
        stateMachine.afterCommit(() -> poller.stop(requestId));
    }

    private Optional<PaymentAttempt> latestOpenAttempt(UUID requestId) {
        return attemptRepository.findByRequestIdOrderByAttemptNumberAsc(requestId).stream()
                .filter(PaymentAttempt::isOpen)
                .max(Comparator.comparingInt(PaymentAttempt::getAttemptNumber));
    }

    private PaymentAttempt requireAttempt(UUID attemptId) {
        return attemptRepository.findById(attemptId)
                .orElseThrow(() -> new RequestException(RequestException.PAYMENT_ATTEMPT_NOT_FOUND,
                        "Payment attempt " + attemptId + " not found"));
    }

    private static PaymentHandle handle(PaymentAttempt attempt, PaymentHandle.Kind kind, boolean confirmed) {
        return PaymentHandle.builder()
                .attemptId(attempt.getId())
                .requestId(attempt.getRequestId())
                .kind(kind)
                .method(attempt.getMethod())
                .status(attempt.getStatus())
                .checkoutUrl(attempt.getCheckoutUrl())
                .confirmed(confirmed)
                .build();
    }
}
