package com.roadside.request.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Transactional outbox entry for lifecycle and payment events.
 *
 * Written in the same transaction as the request row it describes, so an
 * event exists if and only if its change committed. {@code OutboxRelay}
 * forwards PENDING entries to Kafka and marks them PUBLISHED.
 *
 * Lifecycle: PENDING -> PUBLISHED, or PENDING -> FAILED after the retry budget.
 */
@Entity
@Table(name = "event_outbox",
        indexes = {
                @Index(name = "idx_outbox_status", columnList = "status"),
                @Index(name = "idx_outbox_created_at", columnList = "created_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class EventOutbox {

    public enum OutboxStatus { PENDING, PUBLISHED, FAILED }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    /** Destination topic; also selects the payload type. */
    @Column(name = "topic", nullable = false, length = 64)
    private String topic;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private OutboxStatus status = OutboxStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count")
    @Builder.Default
    private int retryCount = 0;
}
