package com.roadside.request.entity;

import com.roadside.shared.enums.Party;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "chat_messages",
        indexes = @Index(name = "idx_chat_request", columnList = "request_id, created_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    /** SYSTEM for entries the platform writes itself (proposals, acceptance, withdrawals). */
    @Enumerated(EnumType.STRING)
    @Column(name = "sender_type", nullable = false)
    private Party senderType;

    @Column(name = "sender_id")
    private String senderId;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
