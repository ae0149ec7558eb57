package com.roadside.request.metrics;

import com.roadside.shared.enums.Party;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer metrics for the request lifecycle.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   request_created_total{status="created|rejected|duplicate"}
 *   request_time_to_accept_seconds          time from creation to a provider accepting
 *   matching_offers_total{outcome="broadcast|accepted|declined|lapsed|withdrawn"}
 *   matching_radius_expansions_total
 *   matching_search_exhausted_total
 *   matching_geoindex_failures_total
 *   negotiation_events_total{event="proposal|agreed"}
 *   payment_confirmed_total{channel="sync|push|poll|direct|reconciliation"}
 *   payment_failed_total
 *   payment_refund_required_total           captures that arrived after the request was settled or canceled
 *   payment_poll_ceiling_total
 *   request_canceled_total{by="client|provider|system"}
 *   request_auto_finished_total
 */
@Component
public class LifecycleMetrics {

    private final MeterRegistry registry;
    private final Counter requestCreatedCounter;
    private final Counter requestRejectedCounter;
    private final Counter idempotentReplayCounter;
    private final Counter offersBroadcastCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerDeclinedCounter;
    private final Counter offerLapsedCounter;
    private final Counter providerWithdrawnCounter;
    private final Counter radiusExpansionCounter;
    private final Counter searchExhaustedCounter;
    private final Counter geoIndexFailureCounter;
    private final Counter proposalCounter;
    private final Counter valueAgreedCounter;
    private final Counter paymentFailedCounter;
    private final Counter pollCeilingCounter;
    private final Counter refundRequiredCounter;
    private final Counter autoFinishedCounter;
    private final Timer   timeToAcceptTimer;

    public LifecycleMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requestCreatedCounter = Counter.builder("request.created")
                .tag("status", "created")
                .description("Service requests successfully created")
                .register(registry);

        this.requestRejectedCounter = Counter.builder("request.created")
                .tag("status", "rejected")
                .description("Service requests rejected (kill switch, active request)")
                .register(registry);

        this.idempotentReplayCounter = Counter.builder("request.created")
                .tag("status", "duplicate")
                .description("Idempotent replays of a create call")
                .register(registry);

        this.offersBroadcastCounter = offerCounter(registry, "broadcast");
        this.offerAcceptedCounter = offerCounter(registry, "accepted");
        this.offerDeclinedCounter = offerCounter(registry, "declined");
        this.offerLapsedCounter = offerCounter(registry, "lapsed");
        this.providerWithdrawnCounter = offerCounter(registry, "withdrawn");

        this.radiusExpansionCounter = Counter.builder("matching.radius.expansions")
                .description("Search sessions that moved to the next radius")
                .register(registry);

        this.searchExhaustedCounter = Counter.builder("matching.search.exhausted")
                .description("Search sessions that ran off the end of the radius ladder")
                .register(registry);

        this.geoIndexFailureCounter = Counter.builder("matching.geoindex.failures")
                .description("GeoIndex queries that failed because the index was unreachable")
                .register(registry);

        this.proposalCounter = Counter.builder("negotiation.events")
                .tag("event", "proposal")
                .register(registry);

        this.valueAgreedCounter = Counter.builder("negotiation.events")
                .tag("event", "agreed")
                .register(registry);

        this.paymentFailedCounter = Counter.builder("payment.failed")
                .description("Payment attempts the gateway reported as failed")
                .register(registry);

        this.pollCeilingCounter = Counter.builder("payment.poll.ceiling")
                .description("Confirmation polls that hit the ceiling without an answer")
                .register(registry);

        this.refundRequiredCounter = Counter.builder("payment.refund_required")
                .description("Gateway captures that no longer pay for a request and must be refunded")
                .register(registry);

        this.autoFinishedCounter = Counter.builder("request.auto_finished")
                .description("Requests finished by the system after the client did not confirm completion")
                .register(registry);

        this.timeToAcceptTimer = Timer.builder("request.time_to_accept")
                .description("Time from request creation to a provider accepting it")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofSeconds(1))
                .maximumExpectedValue(Duration.ofMinutes(30))
                .register(registry);
    }

    private static Counter offerCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("matching.offers")
                .tag("outcome", outcome)
                .register(registry);
    }

    public void recordRequestCreated()      { requestCreatedCounter.increment(); }
    public void recordRequestRejected()     { requestRejectedCounter.increment(); }
    public void recordIdempotentReplay()    { idempotentReplayCounter.increment(); }
    public void recordOffersBroadcast(int n) { offersBroadcastCounter.increment(n); }
    public void recordOfferAccepted()       { offerAcceptedCounter.increment(); }
    public void recordOfferDeclined()       { offerDeclinedCounter.increment(); }
    public void recordOffersLapsed(int n)   { offerLapsedCounter.increment(n); }
    public void recordProviderWithdrawn()   { providerWithdrawnCounter.increment(); }
    public void recordRadiusExpansion()     { radiusExpansionCounter.increment(); }
    public void recordSearchExhausted()     { searchExhaustedCounter.increment(); }
    public void recordGeoIndexFailure()     { geoIndexFailureCounter.increment(); }
    public void recordProposal()            { proposalCounter.increment(); }
    public void recordValueAgreed()         { valueAgreedCounter.increment(); }
    public void recordPaymentFailed()       { paymentFailedCounter.increment(); }
    public void recordPollCeiling()         { pollCeilingCounter.increment(); }
    public void recordRefundRequired()      { refundRequiredCounter.increment(); }
    public void recordAutoFinished()        { autoFinishedCounter.increment(); }
    public void recordTimeToAccept(Duration d) { timeToAcceptTimer.record(d); }

    public void recordPaymentConfirmed(String channel) {
        registry.counter("payment.confirmed", "channel", channel.toLowerCase(Locale.ROOT)).increment();
    }

    public void recordCancellation(Party by) {
        registry.counter("request.canceled", "by", by.name().toLowerCase(Locale.ROOT)).increment();
    }
}
