package com.roadside.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadside.notification.service.NotificationDispatcher;
import com.roadside.shared.events.PaymentEvent;
import com.roadside.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;

/**
 * Payment receipts.
 *
 * payment.confirmed -> receipt push to the client
 * payment.failed    -> no push here; the client hears about it from the status change
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventConsumer {

    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = {KafkaTopics.PAYMENT_CONFIRMED, KafkaTopics.PAYMENT_FAILED},
            groupId = "notification-service-payments"
    )
    public void consumePaymentEvents(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            Acknowledgment ack) {

        try {
            PaymentEvent event = objectMapper.readValue(payload, PaymentEvent.class);

            switch (topic) {
                case KafkaTopics.PAYMENT_CONFIRMED -> sendReceipt(event);
                case KafkaTopics.PAYMENT_FAILED -> log.info("Payment attempt {} of request {} failed: {}",
                        event.getAttemptId(), event.getRequestId(), event.getFailureReason());
                default -> log.debug("Unhandled payment topic: {}", topic);
            }

            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to process payment notification for topic {}: {}", topic, e.getMessage(), e);
            ack.acknowledge();
        }
    }

    private void sendReceipt(PaymentEvent event) {
        String amount = event.getAmount() != null
                ? event.getAmount().setScale(2, RoundingMode.HALF_UP).toPlainString()
                : "N/A";
        String currency = event.getCurrency() != null ? event.getCurrency() : "BRL";

        dispatcher.sendPush(event.getClientId(), "Payment receipt",
                String.format("Payment of %s %s received (%s).", amount, currency, event.getPaymentMethod()));

        log.info("Receipt sent to client={} request={} amount={} {} via={}",
                event.getClientId(), event.getRequestId(), amount, currency, event.getConfirmedVia());
    }
}
