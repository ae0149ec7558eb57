package com.roadside.notification.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadside.notification.service.NotificationDispatcher;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import com.roadside.shared.events.PaymentEvent;
import com.roadside.shared.util.KafkaTopics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PaymentEventConsumerTest {

    @Mock private NotificationDispatcher dispatcher;
    @Mock private Acknowledgment ack;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private PaymentEvent.PaymentEventBuilder event(PaymentStatus status) {
        return PaymentEvent.builder()
                .attemptId("att-1")
                .requestId("req-1")
                .clientId("cli_001")
                .providerId("prv_001")
                .amount(new BigDecimal("180"))
                .currency("BRL")
                .paymentMethod(PaymentMethod.INSTANT_TRANSFER)
                .status(status)
                .eventTime(Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("A confirmed payment sends the client a receipt")
    void confirmedSendsReceipt() throws Exception {
        PaymentEventConsumer consumer = new PaymentEventConsumer(dispatcher, objectMapper);

        consumer.consumePaymentEvents(objectMapper.writeValueAsString(
                event(PaymentStatus.CONFIRMED).confirmedVia("PUSH").build()), KafkaTopics.PAYMENT_CONFIRMED, ack);

        verify(dispatcher).sendPush("cli_001", "Payment receipt",
                "Payment of 180.00 BRL received (INSTANT_TRANSFER).");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A failed payment is only logged here")
    void failedIsNotPushed() throws Exception {
        PaymentEventConsumer consumer = new PaymentEventConsumer(dispatcher, objectMapper);

        consumer.consumePaymentEvents(objectMapper.writeValueAsString(
                event(PaymentStatus.FAILED).failureReason("card_declined").build()), KafkaTopics.PAYMENT_FAILED, ack);

        verifyNoInteractions(dispatcher);
        verify(ack).acknowledge();
    }
}
