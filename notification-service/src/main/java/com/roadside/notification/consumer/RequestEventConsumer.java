package com.roadside.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadside.notification.service.NotificationDispatcher;
import com.roadside.notification.service.StatusEventDeduplicator;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.SearchState;
import com.roadside.shared.events.ProviderOfferSentEvent;
import com.roadside.shared.events.RequestStatusChangedEvent;
import com.roadside.shared.events.SearchProgressEvent;
import com.roadside.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Slf4j
@Component
@RequiredArgsConstructor
public class RequestEventConsumer {

    private final NotificationDispatcher dispatcher;
    private final StatusEventDeduplicator deduplicator;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = {KafkaTopics.PROVIDER_OFFER_SENT, KafkaTopics.REQUEST_SEARCH_PROGRESS},
            groupId = "notification-service-matching"
    )
    public void consumeMatchingEvents(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            Acknowledgment ack) {

        try {
            switch (topic) {
                case KafkaTopics.PROVIDER_OFFER_SENT -> {
                    ProviderOfferSentEvent event = objectMapper.readValue(payload, ProviderOfferSentEvent.class);
                    for (String providerId : event.getProviderIds()) {
                        dispatcher.playSound(providerId, NotificationDispatcher.SOUND_NEW_OFFER);
                        dispatcher.sendPush(providerId, "New service request",
                                event.getServiceType() + " at " + event.getOriginAddress()
                                        + " (within " + Math.round(event.getRadiusKm()) + " km)");
                    }
                }
                case KafkaTopics.REQUEST_SEARCH_PROGRESS -> {
                    SearchProgressEvent event = objectMapper.readValue(payload, SearchProgressEvent.class);
                    if (event.getState() == SearchState.TIMEOUT) {
                        dispatcher.sendPush(event.getClientId(), "No providers available",
                                "We could not find a provider nearby. You can try again.");
                    }
                }
                default -> log.debug("Unhandled topic: {}", topic);
            }
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process notification for topic {}: {}", topic, e.getMessage(), e);
            ack.acknowledge();
        }
    }

    @KafkaListener(
            topics = KafkaTopics.REQUEST_STATUS_CHANGED,
            groupId = "notification-service-requests"
    )
    public void consumeStatusChanges(@Payload String payload, Acknowledgment ack) {
        try {
            RequestStatusChangedEvent event = objectMapper.readValue(payload, RequestStatusChangedEvent.class);
            if (deduplicator.firstSighting(event.getRequestId(), event.getUpdatedAt())) {
                notifyParties(event);
            }
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process status notification: {}", e.getMessage(), e);
            ack.acknowledge();
        }
    }

    private void notifyParties(RequestStatusChangedEvent event) {
        String reason = event.getReason();
        if (RequestStatusChangedEvent.REASON_PROPOSAL.equals(reason)) {
            String body = "Proposed value: R$ " + brl(event.getProposedValue());
            dispatcher.sendPush(event.getClientId(), "New proposal", body);
            dispatcher.sendPush(event.getProviderId(), "New proposal", body);
            return;
        }
        if (RequestStatusChangedEvent.REASON_VALUE_ACCEPTED.equals(reason)) {
            String body = "Value agreed: R$ " + brl(event.getAgreedValue());
            dispatcher.sendPush(event.getClientId(), "Value agreed", body);
            dispatcher.sendPush(event.getProviderId(), "Value agreed", body);
            return;
        }
        if (RequestStatusChangedEvent.REASON_PROVIDER_WITHDREW.equals(reason)) {
            dispatcher.sendPush(event.getClientId(), "Provider withdrew", "We are looking for another provider.");
            return;
        }
        if (RequestStatusChangedEvent.REASON_PAYMENT_FAILED.equals(reason)) {
            dispatcher.sendPush(event.getClientId(), "Payment failed", "Your payment did not go through. Please try again.");
            return;
        }
        if (!event.isTransition()) {
            return;
        }

        RequestStatus status = event.getStatus();
        switch (status) {
            case ACCEPTED -> dispatcher.sendPush(event.getClientId(), "Provider found",
                    "A provider accepted your request.");
            case AWAITING_PAYMENT -> dispatcher.sendPush(event.getClientId(), "Ready for payment",
                    "Pay R$ " + brl(event.getAgreedValue()) + " to start the service.");
            case IN_SERVICE -> {
                if (event.getPreviousStatus() == RequestStatus.PENDING_CLIENT_CONFIRMATION) {
                    dispatcher.sendPush(event.getProviderId(), "Completion disputed",
                            "The client reported the service is not finished.");
                } else {
                    dispatcher.sendPush(event.getClientId(), "Payment confirmed", "Your provider is on the way.");
                    dispatcher.sendPush(event.getProviderId(), "Payment confirmed", "You can start the service.");
                }
            }
            case PENDING_CLIENT_CONFIRMATION -> dispatcher.sendPush(event.getClientId(), "Service completed?",
                    "Your provider marked the service as done. Please confirm.");
            case FINISHED -> {
                dispatcher.sendPush(event.getClientId(), "Service finished", "Thank you for using our service!");
                dispatcher.sendPush(event.getProviderId(), "Service finished", "The request is closed.");
            }
            case CANCELED -> {
                dispatcher.sendPush(event.getClientId(), "Request canceled", "The request has been canceled.");
                dispatcher.sendPush(event.getProviderId(), "Request canceled", "The request has been canceled.");
            }
            default -> log.debug("No notification for request {} entering {}", event.getRequestId(), status);
        }
    }

    private static String brl(BigDecimal value) {
        return value != null ? value.setScale(2, RoundingMode.HALF_UP).toPlainString() : "-";
    }
}
