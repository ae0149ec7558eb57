package com.roadside.request.payment;

import com.roadside.request.config.PaymentProperties;
import com.roadside.request.entity.PaymentAttempt;
import com.roadside.request.repository.PaymentAttemptRepository;
import com.roadside.shared.enums.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconciliation sweep for instant transfers whose bounded polling ran out
 * before the gateway settled them (client closed the app, push lost...).
 *
 * Attempts still CONFIRMING past the polling ceiling are checked once per run,
 * together with recently superseded intents the client may have paid anyway.
 * Paid ones go through the regular idempotent path, which settles the request
 * or flags the capture for refund. Nothing is ever declared failed here: a
 * gateway that still says PENDING is simply asked again on the next run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentReconciliationJob {

    private final PaymentAttemptRepository attemptRepository;
    private final PaymentCoordinator paymentCoordinator;
    private final PaymentProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${payment.reconciliation.interval-ms:300000}")
    public void reconcileConfirming() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getPollCeiling());
        List<PaymentAttempt> stale = new ArrayList<>(
                attemptRepository.findByStatusAndCreatedAtBefore(PaymentStatus.CONFIRMING, cutoff));
        int confirming = stale.size();
        stale.addAll(attemptRepository.findByStatusAndGatewayIntentIdIsNotNullAndCreatedAtAfter(
                PaymentStatus.SUPERSEDED, now.minus(properties.getSupersededReconciliationWindow())));
        if (stale.isEmpty()) return;

        log.info("Reconciliation: {} attempt(s) CONFIRMING since before {}, {} superseded intent(s)",
                confirming, cutoff, stale.size() - confirming);
        int confirmed = 0;
        for (PaymentAttempt attempt : stale) {
            try {
                if (paymentCoordinator.reconcile(attempt)) {
                    confirmed++;
                }
            } catch (RuntimeException e) {
                log.warn("Reconciliation: attempt {} of request {} not settled: {}",
                        attempt.getAttemptNumber(), attempt.getRequestId(), e.getMessage());
            }
        }
        log.info("Reconciliation: {} of {} attempt(s) settled", confirmed, stale.size());
    }
}
