package com.roadside.request.model;

import com.roadside.shared.enums.Party;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ChatMessageView {
    private Party senderType;
    private String senderId;
    private String message;
    private Instant createdAt;
}
