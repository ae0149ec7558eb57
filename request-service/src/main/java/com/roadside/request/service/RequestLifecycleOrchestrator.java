package com.roadside.request.service;

import com.roadside.request.config.LifecycleProperties;
import com.roadside.request.entity.ChatMessage;
import com.roadside.request.entity.GeoLocation;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.InvalidValueException;
import com.roadside.request.exception.RequestException;
import com.roadside.request.matching.MatchingEngine;
import com.roadside.request.matching.SearchSession;
import com.roadside.request.metrics.LifecycleMetrics;
import com.roadside.request.model.ChatMessageView;
import com.roadside.request.model.CreateServiceRequest;
import com.roadside.request.model.LocationPayload;
import com.roadside.request.model.PartyActionPayload;
import com.roadside.request.model.PaymentHandle;
import com.roadside.request.model.ServiceRequestView;
import com.roadside.request.negotiation.NegotiationProtocol;
import com.roadside.request.negotiation.NegotiationState;
import com.roadside.request.payment.PaymentCoordinator;
import com.roadside.request.repository.ChatMessageRepository;
import com.roadside.request.repository.ServiceRequestRepository;
import com.roadside.shared.enums.CancelReasonCategory;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.events.RequestStatusChangedEvent;
import com.roadside.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for everything that happens to a service request.
 *
 * Every mutation goes through {@link RequestStateMachine#mutate}, so one request
 * is only ever changed by one writer at a time and every change is broadcast
 * after it commits. Work that talks to other components (starting a search,
 * forcing an expansion) runs after the mutation returns, or in a commit hook
 * when it must happen before the next writer gets the lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestLifecycleOrchestrator {

    public static final String AUTO_FINISH_CLIENT_TIMEOUT = "client_timeout";
    static final String REASON_COMPLETION_DISPUTED = "COMPLETION_DISPUTED";

    private final RequestStateMachine stateMachine;
    private final ServiceRequestRepository requestRepository;
    private final ChatMessageRepository chatMessageRepository;
    private final MatchingEngine matchingEngine;
    private final NegotiationProtocol negotiation;
    private final PaymentCoordinator paymentCoordinator;
    private final FeatureFlagService featureFlagService;
    private final LifecycleProperties properties;
    private final LifecycleMetrics metrics;
    private final Clock clock;

    // ─── creation ───

    public ServiceRequestView createRequest(CreateServiceRequest cmd, String idempotencyKey) {
        if (featureFlagService.isEnabled(FeatureFlagService.REQUEST_KILL_SWITCH, false)) {
            metrics.recordRequestRejected();
            throw new RequestException(RequestException.SERVICE_UNAVAILABLE,
                    "New service requests are temporarily disabled");
        }
        if (idempotencyKey != null) {
            Optional<ServiceRequest> existing = requestRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotentReplay();
                log.info("Idempotent create: key {} already maps to request {}", idempotencyKey, existing.get().getId());
                return toView(existing.get());
            }
        }
        if (requestRepository.existsByClientIdAndStatusIn(cmd.getClientId(), RequestStatus.activeStatuses())) {
            metrics.recordRequestRejected();
            throw new RequestException(RequestException.ACTIVE_REQUEST_EXISTS,
                    "Client " + cmd.getClientId() + " already has an active request");
        }

        Instant now = clock.instant();
        ServiceRequest opened = ServiceRequest.open(UUID.randomUUID(), cmd.getClientId(), cmd.getServiceType(),
                toLocation(cmd.getOrigin()), toLocation(cmd.getDestination()), cmd.getVehicleInfo(),
                idempotencyKey, now);
        ServiceRequest searching;
        try {
            searching = stateMachine.insert(opened, request -> {
                request.transitionTo(RequestStatus.SEARCHING, null, now);
                return request;
            });
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            // Lost a race with a concurrent create carrying the same key.
            metrics.recordIdempotentReplay();
            return requestRepository.findByIdempotencyKey(idempotencyKey)
                    .map(this::toView)
                    .orElseThrow(() -> e);
        }

        metrics.recordRequestCreated();
        log.info("Request {} created by client {} ({})", searching.getId(), searching.getClientId(),
                searching.getServiceType());
        matchingEngine.startSearch(searching);
        return toView(searching);
    }

    public ServiceRequestView getRequest(UUID requestId) {
        return toView(stateMachine.load(requestId));
    }

    public List<ChatMessageView> getChat(UUID requestId) {
        stateMachine.load(requestId);
        return chatMessageRepository.findByRequestIdOrderByCreatedAtAsc(requestId).stream()
                .map(m -> ChatMessageView.builder()
                        .senderType(m.getSenderType())
                        .senderId(m.getSenderId())
                        .message(m.getMessage())
                        .createdAt(m.getCreatedAt())
                        .build())
                .toList();
    }

    // ─── matching ───

    /**
     * First accept wins; later ones find the request no longer SEARCHING. The
     * provider's lock is held across the busy check and the accept, so one
     * provider can never win two requests at once.
     */
    public ServiceRequestView providerAccept(UUID requestId, String providerId) {
        ServiceRequest accepted = stateMachine.withProviderLock(providerId, () -> {
            if (requestRepository.existsByProviderIdAndStatusIn(providerId, RequestStatus.engagedStatuses())) {
                throw new RequestException(RequestException.PROVIDER_BUSY,
                        "Provider " + providerId + " is already engaged in another request");
            }
            return stateMachine.mutate(requestId, request -> {
                requireOffered(request, providerId);
                request.acceptBy(providerId, clock.instant());
                matchingEngine.hold(requestId);
                stateMachine.onCompletion(() -> matchingEngine.discard(requestId),
                        () -> matchingEngine.release(requestId));
                return request;
            });
        });
        metrics.recordOfferAccepted();
        metrics.recordTimeToAccept(Duration.between(accepted.getCreatedAt(), accepted.getUpdatedAt()));
        return toView(accepted);
    }

    public ServiceRequestView declineOffer(UUID requestId, String providerId) {
        ServiceRequest declined = stateMachine.mutate(requestId, request -> {
            if (request.getStatus() != RequestStatus.SEARCHING) {
                throw new InvalidTransitionException("Request " + requestId + " has no open offer to decline");
            }
            requireOffered(request, providerId);
            request.excludeProvider(providerId, RequestStatusChangedEvent.REASON_OFFER_DECLINED, clock.instant());
            matchingEngine.mirrorExclusions(requestId, request.getExcludedProviderIds());
            return request;
        });
        metrics.recordOfferDeclined();
        log.info("Request {}: provider {} declined, forcing expansion", requestId, providerId);
        matchingEngine.forceExpand(requestId, Set.copyOf(declined.getExcludedProviderIds()));
        return toView(declined);
    }

    /** The engaged provider backs out before a value was agreed; the search starts over without them. */
    public ServiceRequestView withdraw(UUID requestId, PartyActionPayload payload) {
        ServiceRequest released = stateMachine.mutate(requestId, request -> {
            request.requireParty(payload.getActorId(), Party.PROVIDER);
            Instant now = clock.instant();
            String providerId = request.releaseProvider(RequestStatusChangedEvent.REASON_PROVIDER_WITHDREW, now);
            chatMessageRepository.save(ChatMessage.builder()
                    .requestId(requestId)
                    .senderType(Party.SYSTEM)
                    .senderId(providerId)
                    .message("Provider withdrew" + (payload.getReason() != null ? ": " + payload.getReason() : ""))
                    .createdAt(now)
                    .build());
            return request;
        });
        metrics.recordProviderWithdrawn();
        log.info("Request {}: provider {} withdrew, searching again", requestId, payload.getActorId());
        matchingEngine.startSearch(released);
        return toView(released);
    }

    /** Only after the search timed out. Lapsed offers are forgotten; declines and withdrawals are not. */
    public ServiceRequestView retrySearch(UUID requestId, String clientId) {
        ServiceRequest retried = stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            if (request.getStatus() != RequestStatus.SEARCHING) {
                throw new InvalidTransitionException("Request " + requestId + " is not searching");
            }
            if (matchingEngine.isSearchActive(requestId)) {
                throw new InvalidTransitionException("Search for request " + requestId + " is still running");
            }
            request.recordChange(RequestStatusChangedEvent.REASON_SEARCH_RETRY, clock.instant());
            return request;
        });
        matchingEngine.startSearch(retried);
        return toView(retried);
    }

    // ─── negotiation ───

    public ServiceRequestView beginNegotiation(UUID requestId, String providerId) {
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(providerId, Party.PROVIDER);
            if (request.getStatus() != RequestStatus.NEGOTIATING) {
                request.transitionTo(RequestStatus.NEGOTIATING, null, clock.instant());
            }
            return request;
        }));
    }

    public ServiceRequestView propose(UUID requestId, String actorId, BigDecimal value) {
        return toView(stateMachine.mutate(requestId, request -> {
            Party side = request.requireParty(actorId);
            negotiation.propose(request, value, side, actorId, clock.instant());
            return request;
        }));
    }

    public ServiceRequestView acceptProposal(UUID requestId, String actorId) {
        return toView(stateMachine.mutate(requestId, request -> {
            Party side = request.requireParty(actorId);
            negotiation.accept(request, side, actorId, clock.instant());
            return request;
        }));
    }

    public ServiceRequestView setDirectPayment(UUID requestId, String clientId, boolean enabled) {
        if (enabled && !featureFlagService.isEnabled(FeatureFlagService.DIRECT_PAYMENT_ENABLED, true)) {
            throw new RequestException(RequestException.SERVICE_UNAVAILABLE, "Direct payment is disabled");
        }
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            negotiation.setDirectPayment(request, enabled, clock.instant());
            return request;
        }));
    }

    public ServiceRequestView confirmAndProceed(UUID requestId, String clientId) {
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            negotiation.confirmAndProceed(request, clock.instant());
            return request;
        }));
    }

    // ─── payment ───

    public PaymentHandle beginPayment(UUID requestId, String clientId, PaymentMethod method) {
        return paymentCoordinator.beginPayment(requestId, clientId, method);
    }

    public PaymentHandle resumePaymentConfirmation(UUID requestId, String clientId) {
        return paymentCoordinator.resumeConfirmation(requestId, clientId);
    }

    public PaymentHandle confirmDirectReceipt(UUID requestId, String providerId) {
        return paymentCoordinator.confirmDirectReceipt(requestId, providerId);
    }

    // ─── completion ───

    public ServiceRequestView completeService(UUID requestId, String providerId) {
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(providerId, Party.PROVIDER);
            request.requestCompletion(clock.instant());
            return request;
        }));
    }

    public ServiceRequestView confirmCompletion(UUID requestId, String clientId) {
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            request.finish(null, clock.instant());
            return request;
        }));
    }

    public ServiceRequestView disputeCompletion(UUID requestId, String clientId, String reason) {
        return toView(stateMachine.mutate(requestId, request -> {
            request.requireParty(clientId, Party.CLIENT);
            Instant now = clock.instant();
            request.disputeCompletion(REASON_COMPLETION_DISPUTED, now);
            if (reason != null && !reason.isBlank()) {
                chatMessageRepository.save(ChatMessage.builder()
                        .requestId(requestId)
                        .senderType(Party.CLIENT)
                        .senderId(clientId)
                        .message(reason)
                        .createdAt(now)
                        .build());
            }
            return request;
        }));
    }

    /**
     * Finishes requests whose client never confirmed the provider's completion.
     *
     * @return how many were finished
     */
    public int autoFinishExpired(Instant now) {
        if (!featureFlagService.isEnabled(FeatureFlagService.AUTO_FINISH_ENABLED, true)) {
            return 0;
        }
        Instant cutoff = now.minus(properties.getAutoFinishAfter());
        List<ServiceRequest> due = requestRepository.findByStatusAndProviderFinishRequestedAtBefore(
                RequestStatus.PENDING_CLIENT_CONFIRMATION, cutoff);
        int finished = 0;
        for (ServiceRequest candidate : due) {
            try {
                boolean done = stateMachine.mutate(candidate.getId(), request -> {
                    Instant requestedAt = request.getProviderFinishRequestedAt();
                    if (request.getStatus() != RequestStatus.PENDING_CLIENT_CONFIRMATION
                            || requestedAt == null || requestedAt.isAfter(cutoff)) {
                        return false;
                    }
                    request.finish(AUTO_FINISH_CLIENT_TIMEOUT, now);
                    return true;
                });
                if (done) {
                    finished++;
                    metrics.recordAutoFinished();
                }
            } catch (RequestException e) {
                log.warn("Auto-finish skipped request {}: {}", candidate.getId(), e.getMessage());
            }
        }
        if (finished > 0) {
            log.info("Auto-finished {} request(s) not confirmed since {}", finished, cutoff);
        }
        return finished;
    }

    // ─── cancellation ───

    public ServiceRequestView cancel(UUID requestId, PartyActionPayload payload) {
        ServiceRequest canceled = stateMachine.mutate(requestId, request -> {
            Party by = request.requireParty(payload.getActorId());
            CancelReasonCategory category = payload.getCategory() != null
                    ? payload.getCategory() : CancelReasonCategory.OTHER;
            if (!category.isAllowedFor(by)) {
                throw new InvalidValueException(category + " is not a valid cancel reason for the " + by);
            }
            Instant now = clock.instant();
            request.cancel(by, category, payload.getReason(), now);
            matchingEngine.hold(requestId);
            stateMachine.onCompletion(() -> matchingEngine.cancel(requestId),
                    () -> matchingEngine.release(requestId));
            paymentCoordinator.abandonPayments(request, now);
            return request;
        });
        metrics.recordCancellation(canceled.getCanceledBy());
        return toView(canceled);
    }

    // ─── helpers ───

    /** Only providers the live session actually offered the request to may answer. */
    private void requireOffered(ServiceRequest request, String providerId) {
        if (!matchingEngine.wasOffered(request.getId(), providerId)) {
            throw new InvalidTransitionException(
                    "Request " + request.getId() + " was not offered to provider " + providerId);
        }
    }

    private static GeoLocation toLocation(LocationPayload payload) {
        if (payload == null) {
            return null;
        }
        return new GeoLocation(
                payload.getLatitude() != null ? payload.getLatitude() : Double.NaN,
                payload.getLongitude() != null ? payload.getLongitude() : Double.NaN,
                payload.getAddress());
    }

    ServiceRequestView toView(ServiceRequest request) {
        Optional<SearchSession> session = request.getStatus() == RequestStatus.SEARCHING
                ? matchingEngine.findSession(request.getId())
                : Optional.empty();
        return ServiceRequestView.builder()
                .requestId(request.getId())
                .clientId(request.getClientId())
                .providerId(request.getProviderId())
                .serviceType(request.getServiceType())
                .requiresDestination(request.requiresDestination())
                .origin(request.getOrigin())
                .destination(request.getDestination())
                .vehicleInfo(request.getVehicleInfo())
                .status(request.getStatus())
                .negotiation(NegotiationState.of(request))
                .paymentMethod(request.getPaymentMethod())
                .paymentStatus(request.getPaymentStatus())
                .paymentConfirmed(request.isPaymentConfirmed())
                .excludedProviderIds(Set.copyOf(request.getExcludedProviderIds()))
                .searchState(session.map(SearchSession::getState).orElse(null))
                .searchRadiusKm(session.map(SearchSession::currentRadiusKm).orElse(null))
                .cancelReasonCategory(request.getCancelReasonCategory())
                .cancelReasonText(request.getCancelReasonText())
                .canceledBy(request.getCanceledBy())
                .autoFinishReason(request.getAutoFinishReason())
                .createdAt(request.getCreatedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
