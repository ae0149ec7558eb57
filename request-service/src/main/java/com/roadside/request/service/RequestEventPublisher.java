package com.roadside.request.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadside.request.entity.EventOutbox;
import com.roadside.request.entity.PaymentAttempt;
import com.roadside.request.entity.RequestChange;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.geo.ProviderCandidate;
import com.roadside.request.matching.SearchSession;
import com.roadside.request.repository.EventOutboxRepository;
import com.roadside.shared.enums.SearchState;
import com.roadside.shared.events.PaymentEvent;
import com.roadside.shared.events.ProviderOfferSentEvent;
import com.roadside.shared.events.RequestStatusChangedEvent;
import com.roadside.shared.events.SearchProgressEvent;
import com.roadside.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Change broadcaster. Everything is keyed by request id so one request's
 * events stay ordered on a single partition.
 *
 * Status changes and payment events describe committed rows, so they go
 * through the transactional outbox and leave only if the mutation commits.
 * Offers and search progress come from the matching engine outside any
 * transaction and are sent straight away.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final EventOutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    public void publishChange(ServiceRequest request, RequestChange change) {
        RequestStatusChangedEvent event = RequestStatusChangedEvent.builder()
                .requestId(request.getId().toString())
                .clientId(request.getClientId())
                .providerId(request.getProviderId())
                .status(change.to())
                .previousStatus(change.from())
                .paymentStatus(request.getPaymentStatus())
                .proposedValue(request.getProposedValue())
                .agreedValue(request.getAgreedValue())
                .reason(change.reason())
                .updatedAt(change.at())
                .build();
        writeOutbox(request.getId(), KafkaTopics.REQUEST_STATUS_CHANGED, event);
    }

    public void publishOffer(SearchSession session, List<ProviderCandidate> candidates, Instant at) {
        ProviderOfferSentEvent event = ProviderOfferSentEvent.builder()
                .requestId(session.getRequestId().toString())
                .clientId(session.getClientId())
                .providerIds(candidates.stream().map(ProviderCandidate::getProviderId).toList())
                .serviceType(session.getServiceType())
                .originAddress(session.getOrigin().getAddress())
                .radiusKm(session.currentRadiusKm())
                .radiusStep(session.getCurrentIndex() + 1)
                .offeredAt(at)
                .build();
        kafkaTemplate.send(KafkaTopics.PROVIDER_OFFER_SENT, session.getRequestId().toString(), event);
    }

    public void publishSearchProgress(SearchSession session, SearchState previous,
                                      int candidateCount, String error, Instant at) {
        SearchProgressEvent event = SearchProgressEvent.builder()
                .requestId(session.getRequestId().toString())
                .clientId(session.getClientId())
                .previousState(previous)
                .state(session.getState())
                .radiusKm(session.currentRadiusKm())
                .radiusStep(session.getCurrentIndex() + 1)
                .totalSteps(session.getRadiusLadder().size())
                .candidateCount(candidateCount)
                .error(error)
                .occurredAt(at)
                .build();
        kafkaTemplate.send(KafkaTopics.REQUEST_SEARCH_PROGRESS, session.getRequestId().toString(), event);
    }

    public void publishPayment(ServiceRequest request, PaymentAttempt attempt, String topic, Instant at) {
        PaymentEvent event = PaymentEvent.builder()
                .attemptId(attempt.getId() != null ? attempt.getId().toString() : null)
                .requestId(request.getId().toString())
                .clientId(request.getClientId())
                .providerId(request.getProviderId())
                .amount(attempt.getAmount())
                .currency(attempt.getCurrency())
                .paymentMethod(attempt.getMethod())
                .intentId(attempt.getGatewayIntentId())
                .status(attempt.getStatus())
                .confirmedVia(attempt.getConfirmedVia())
                .failureReason(attempt.getFailureReason())
                .eventTime(at)
                .build();
        writeOutbox(request.getId(), topic, event);
    }

    private void writeOutbox(UUID requestId, String topic, Object event) {
        try {
            outboxRepository.save(EventOutbox.builder()
                    .requestId(requestId)
                    .topic(topic)
                    .payload(objectMapper.writeValueAsString(event))
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise outbox payload for request {} on {}: {}", requestId, topic, e.getMessage(), e);
            throw new IllegalStateException("Outbox serialisation failed", e);
        }
    }
}
