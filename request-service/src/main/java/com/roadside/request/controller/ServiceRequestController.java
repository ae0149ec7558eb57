package com.roadside.request.controller;

import com.roadside.request.model.BeginPaymentPayload;
import com.roadside.request.model.ChatMessageView;
import com.roadside.request.model.CreateServiceRequest;
import com.roadside.request.model.DirectPaymentPayload;
import com.roadside.request.model.PartyActionPayload;
import com.roadside.request.model.PaymentHandle;
import com.roadside.request.model.ProposalPayload;
import com.roadside.request.model.ServiceRequestView;
import com.roadside.request.service.RequestLifecycleOrchestrator;
import com.roadside.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/requests")
@RequiredArgsConstructor
public class ServiceRequestController {

    private final RequestLifecycleOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ApiResponse<ServiceRequestView>> create(
            @Valid @RequestBody CreateServiceRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        ServiceRequestView view = orchestrator.createRequest(request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(view));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<ApiResponse<ServiceRequestView>> get(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getRequest(requestId)));
    }

    @GetMapping("/{requestId}/chat")
    public ResponseEntity<ApiResponse<List<ChatMessageView>>> chat(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.getChat(requestId)));
    }

    // --- matching ---

    @PostMapping("/{requestId}/accept")
    public ResponseEntity<ApiResponse<ServiceRequestView>> accept(
            @PathVariable("requestId") UUID requestId, @RequestParam("providerId") String providerId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.providerAccept(requestId, providerId)));
    }

    @PostMapping("/{requestId}/decline")
    public ResponseEntity<ApiResponse<ServiceRequestView>> decline(
            @PathVariable("requestId") UUID requestId, @RequestParam("providerId") String providerId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.declineOffer(requestId, providerId)));
    }

    @PostMapping("/{requestId}/withdraw")
    public ResponseEntity<ApiResponse<ServiceRequestView>> withdraw(
            @PathVariable("requestId") UUID requestId, @Valid @RequestBody PartyActionPayload payload) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.withdraw(requestId, payload)));
    }

    @PostMapping("/{requestId}/search/retry")
    public ResponseEntity<ApiResponse<ServiceRequestView>> retrySearch(
            @PathVariable("requestId") UUID requestId, @RequestParam("clientId") String clientId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.retrySearch(requestId, clientId)));
    }

    // --- negotiation ---

    @PostMapping("/{requestId}/negotiation/start")
    public ResponseEntity<ApiResponse<ServiceRequestView>> startNegotiation(
            @PathVariable("requestId") UUID requestId, @RequestParam("providerId") String providerId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.beginNegotiation(requestId, providerId)));
    }

    @PostMapping("/{requestId}/proposals")
    public ResponseEntity<ApiResponse<ServiceRequestView>> propose(
            @PathVariable("requestId") UUID requestId, @Valid @RequestBody ProposalPayload payload) {
        return ResponseEntity.ok(ApiResponse.ok(
                orchestrator.propose(requestId, payload.getActorId(), payload.getValue())));
    }

    @PostMapping("/{requestId}/proposals/accept")
    public ResponseEntity<ApiResponse<ServiceRequestView>> acceptProposal(
            @PathVariable("requestId") UUID requestId, @RequestParam("actorId") String actorId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.acceptProposal(requestId, actorId)));
    }

    @PostMapping("/{requestId}/direct-payment")
    public ResponseEntity<ApiResponse<ServiceRequestView>> directPayment(
            @PathVariable("requestId") UUID requestId, @Valid @RequestBody DirectPaymentPayload payload) {
        return ResponseEntity.ok(ApiResponse.ok(
                orchestrator.setDirectPayment(requestId, payload.getClientId(), payload.isEnabled())));
    }

    @PostMapping("/{requestId}/confirm")
    public ResponseEntity<ApiResponse<ServiceRequestView>> confirm(
            @PathVariable("requestId") UUID requestId, @RequestParam("clientId") String clientId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.confirmAndProceed(requestId, clientId)));
    }

    // --- payment ---

    @PostMapping("/{requestId}/payments")
    public ResponseEntity<ApiResponse<PaymentHandle>> beginPayment(
            @PathVariable("requestId") UUID requestId, @Valid @RequestBody BeginPaymentPayload payload) {
        PaymentHandle handle = orchestrator.beginPayment(requestId, payload.getClientId(), payload.getMethod());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(handle));
    }

    @PostMapping("/{requestId}/payments/resume")
    public ResponseEntity<ApiResponse<PaymentHandle>> resumePayment(
            @PathVariable("requestId") UUID requestId, @RequestParam("clientId") String clientId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.resumePaymentConfirmation(requestId, clientId)));
    }

    @PostMapping("/{requestId}/payments/direct-receipt")
    public ResponseEntity<ApiResponse<PaymentHandle>> directReceipt(
            @PathVariable("requestId") UUID requestId, @RequestParam("providerId") String providerId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.confirmDirectReceipt(requestId, providerId)));
    }

    // --- completion / cancel ---

    @PostMapping("/{requestId}/complete")
    public ResponseEntity<ApiResponse<ServiceRequestView>> complete(
            @PathVariable("requestId") UUID requestId, @RequestParam("providerId") String providerId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.completeService(requestId, providerId)));
    }

    @PostMapping("/{requestId}/completion/confirm")
    public ResponseEntity<ApiResponse<ServiceRequestView>> confirmCompletion(
            @PathVariable("requestId") UUID requestId, @RequestParam("clientId") String clientId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.confirmCompletion(requestId, clientId)));
    }

    @PostMapping("/{requestId}/completion/dispute")
    public ResponseEntity<ApiResponse<ServiceRequestView>> disputeCompletion(
            @PathVariable("requestId") UUID requestId,
            @RequestParam("clientId") String clientId,
            @RequestParam(value = "reason", required = false) String reason) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.disputeCompletion(requestId, clientId, reason)));
    }

    @PostMapping("/{requestId}/cancel")
    public ResponseEntity<ApiResponse<ServiceRequestView>> cancel(
            @PathVariable("requestId") UUID requestId, @Valid @RequestBody PartyActionPayload payload) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.cancel(requestId, payload)));
    }
}
