package com.roadside.request.controller;

import com.roadside.request.model.GatewayWebhookPayload;
import com.roadside.request.payment.PaymentCoordinator;
import com.roadside.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway push channel. Always answers 200 once the notification was applied
 * or found redundant, so the gateway stops redelivering.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final PaymentCoordinator paymentCoordinator;

    @PostMapping("/webhook")
    public ResponseEntity<ApiResponse<Boolean>> onStatusChange(@Valid @RequestBody GatewayWebhookPayload payload) {
        log.info("Gateway push: request={} intent={} status={}",
                payload.getRequestId(), payload.getIntentId(), payload.getStatus());
        boolean applied = paymentCoordinator.onGatewayStatus(payload.getRequestId(), payload.getIntentId(),
                payload.getStatus(), payload.getFailureReason(), PaymentCoordinator.VIA_PUSH);
        return ResponseEntity.ok(ApiResponse.ok(applied));
    }
}
