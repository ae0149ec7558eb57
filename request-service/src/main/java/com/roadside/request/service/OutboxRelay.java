package com.roadside.request.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadside.request.entity.EventOutbox;
import com.roadside.request.entity.EventOutbox.OutboxStatus;
import com.roadside.request.repository.EventOutboxRepository;
import com.roadside.shared.events.PaymentEvent;
import com.roadside.shared.events.RequestStatusChangedEvent;
import com.roadside.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Outbox relay: forwards PENDING entries of event_outbox to Kafka.
 *
 * Entries are sent oldest first and keyed by request id, so a request's
 * events reach their partition in commit order. A failed send leaves the entry
 * PENDING for the next run. After MAX_RETRIES it is marked FAILED and kept for
 * manual review; later entries keep flowing. Delivery is at-least-once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    static final int MAX_RETRIES = 5;

    private final EventOutboxRepository outboxRepository;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${outbox.relay.interval-ms:500}")
    @Transactional
    public void publishPendingEntries() {
        List<EventOutbox> pending = outboxRepository.findPendingBatch();
        if (pending.isEmpty()) return;

        log.debug("Outbox: relaying {} pending entries", pending.size());

        for (EventOutbox entry : pending) {
            try {
                Object event = objectMapper.readValue(entry.getPayload(), payloadType(entry.getTopic()));

                // Wait for the broker ack before marking PUBLISHED.
                kafkaTemplate.send(entry.getTopic(), entry.getRequestId().toString(), event).get();

                entry.setStatus(OutboxStatus.PUBLISHED);
                entry.setPublishedAt(clock.instant());
                outboxRepository.save(entry);

                log.debug("Outbox: published topic={} requestId={}", entry.getTopic(), entry.getRequestId());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Outbox: relay interrupted, {} stays PENDING", entry.getId());
                return;
            } catch (Exception e) {
                int retries = entry.getRetryCount() + 1;
                entry.setRetryCount(retries);

                if (retries >= MAX_RETRIES) {
                    entry.setStatus(OutboxStatus.FAILED);
                    log.error("Outbox: permanently failed after {} retries topic={} requestId={} error={}",
                            retries, entry.getTopic(), entry.getRequestId(), e.getMessage());
                } else {
                    log.warn("Outbox: retry {}/{} topic={} requestId={}: {}",
                            retries, MAX_RETRIES, entry.getTopic(), entry.getRequestId(), e.getMessage());
                }
                outboxRepository.save(entry);
            }
        }
    }

    static Class<?> payloadType(String topic) {
        return switch (topic) {
            case KafkaTopics.REQUEST_STATUS_CHANGED -> RequestStatusChangedEvent.class;
            case KafkaTopics.PAYMENT_CONFIRMED, KafkaTopics.PAYMENT_FAILED -> PaymentEvent.class;
            default -> throw new IllegalArgumentException("No outbox payload type for topic " + topic);
        };
    }
}
