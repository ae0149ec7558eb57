package com.roadside.request.model;

import com.roadside.request.payment.GatewayStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GatewayWebhookPayload {

    @NotNull
    private UUID requestId;

    @NotBlank
    private String intentId;

    @NotNull
    private GatewayStatus status;

    private String failureReason;
}
