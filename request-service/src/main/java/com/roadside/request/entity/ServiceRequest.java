package com.roadside.request.entity;

import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.InvalidValueException;
import com.roadside.request.exception.RequestException;
import com.roadside.shared.enums.CancelReasonCategory;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.PaymentMethod;
import com.roadside.shared.enums.PaymentStatus;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.enums.ServiceType;
import com.roadside.shared.events.RequestStatusChangedEvent;
import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregate root of one client request ("chamado").
 *
 * There are no setters: status, negotiation and payment fields only change
 * through the methods below, each of which checks the transition graph in
 * {@link RequestStatus} before touching anything. Callers must hold the
 * per-request lock (see {@code RequestStateMachine}).
 *
 * Every mutation advances {@code updatedAt} strictly and records a
 * {@link RequestChange} that is broadcast after the row is saved.
 */
@Entity
@Table(name = "service_requests",
        indexes = {
                @Index(name = "idx_request_client", columnList = "client_id"),
                @Index(name = "idx_request_provider", columnList = "provider_id"),
                @Index(name = "idx_request_status", columnList = "status"),
                @Index(name = "idx_request_idempotency", columnList = "idempotency_key", unique = true)
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id")
public class ServiceRequest {

    @Id
    private UUID id;

    /** Optimistic lock as a second line behind the Redisson lock (multi-node writers). */
    @Version
    private Long version;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Column(name = "provider_id")
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false)
    private ServiceType serviceType;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "origin_lat", nullable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "origin_lng", nullable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "origin_address", nullable = false, length = 500))
    })
    private GeoLocation origin;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "destination_lat")),
            @AttributeOverride(name = "longitude", column = @Column(name = "destination_lng")),
            @AttributeOverride(name = "address", column = @Column(name = "destination_address", length = 500))
    })
    private GeoLocation destination;

    @Column(name = "vehicle_info")
    private String vehicleInfo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status;

    @Column(name = "proposed_value", precision = 10, scale = 2)
    private BigDecimal proposedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_proposal_by")
    private Party lastProposalBy;

    @Column(name = "value_accepted", nullable = false)
    private boolean valueAccepted;

    @Column(name = "agreed_value", precision = 10, scale = 2)
    private BigDecimal agreedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method")
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_confirmed", nullable = false)
    private boolean paymentConfirmed;

    @Column(name = "direct_payment", nullable = false)
    private boolean directPayment;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "service_request_exclusions", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "provider_id", nullable = false)
    private Set<String> excludedProviderIds = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "cancel_reason_category")
    private CancelReasonCategory cancelReasonCategory;

    @Column(name = "cancel_reason_text", length = 1000)
    private String cancelReasonText;

    @Enumerated(EnumType.STRING)
    @Column(name = "canceled_by")
    private Party canceledBy;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "provider_finish_requested_at")
    private Instant providerFinishRequestedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "auto_finish_reason")
    private String autoFinishReason;

    @Column(name = "idempotency_key", unique = true)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private List<RequestChange> pendingChanges = new ArrayList<>();

    public static ServiceRequest open(UUID id, String clientId, ServiceType serviceType,
                                      GeoLocation origin, GeoLocation destination,
                                      String vehicleInfo, String idempotencyKey, Instant now) {
        if (origin == null || !origin.isValid()) {
            throw new InvalidValueException("Origin must have finite coordinates and a non-empty address");
        }
        if (serviceType.requiresDestination()) {
            if (destination == null || !destination.isValid()) {
                throw new InvalidValueException(serviceType + " requires a valid destination");
            }
        } else if (destination != null) {
            throw new InvalidValueException(serviceType + " does not take a destination");
        }

        ServiceRequest request = new ServiceRequest();
        request.id = id;
        request.clientId = clientId;
        request.serviceType = serviceType;
        request.origin = origin;
        request.destination = destination;
        request.vehicleInfo = vehicleInfo;
        request.idempotencyKey = idempotencyKey;
        request.status = RequestStatus.IDLE;
        request.paymentStatus = PaymentStatus.NONE;
        request.createdAt = now;
        request.updatedAt = now;
        return request;
    }

    public boolean requiresDestination() {
        return serviceType.requiresDestination();
    }

    public Set<String> getExcludedProviderIds() {
        return Collections.unmodifiableSet(excludedProviderIds);
    }

    public boolean isExcluded(String candidateId) {
        return excludedProviderIds.contains(candidateId);
    }

    // --- parties ---

    /** Which side {@code actorId} is on, or null when it is neither. */
    public Party partyOf(String actorId) {
        if (actorId == null) {
            return null;
        }
        if (actorId.equals(clientId)) {
            return Party.CLIENT;
        }
        if (actorId.equals(providerId)) {
            return Party.PROVIDER;
        }
        return null;
    }

    public Party requireParty(String actorId) {
        Party party = partyOf(actorId);
        if (party == null) {
            throw new RequestException(RequestException.NOT_A_PARTY,
                    actorId + " is neither the client nor the provider of request " + id);
        }
        return party;
    }

    public void requireParty(String actorId, Party expected) {
        Party party = requireParty(actorId);
        if (party != expected) {
            throw new InvalidTransitionException(
                    "Only the " + expected.name().toLowerCase(Locale.ROOT) + " may do this on request " + id);
        }
    }

    // --- status ---

    public void transitionTo(RequestStatus next, String reason, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(
                    "Cannot move request " + id + " from " + status + " to " + next);
        }
        if (next.hasEngagedProvider() && providerId == null) {
            throw new InvalidTransitionException("Request " + id + " has no provider; cannot enter " + next);
        }
        if ((next == RequestStatus.IDLE || next == RequestStatus.SEARCHING) && providerId != null) {
            throw new IllegalStateException("Provider must be released before request " + id + " enters " + next);
        }
        RequestStatus previous = status;
        status = next;
        touch(now);
        pendingChanges.add(new RequestChange(previous, next, reason, updatedAt));
    }

    /** Records a broadcastable change that leaves the status where it is. */
    public void recordChange(String reason, Instant now) {
        touch(now);
        pendingChanges.add(new RequestChange(status, status, reason, updatedAt));
    }

    public boolean hasPendingChanges() {
        return !pendingChanges.isEmpty();
    }

    public List<RequestChange> drainChanges() {
        List<RequestChange> drained = List.copyOf(pendingChanges);
        pendingChanges.clear();
        return drained;
    }

    private void touch(Instant now) {
        updatedAt = (updatedAt == null || now.isAfter(updatedAt)) ? now : updatedAt.plusNanos(1_000);
    }

    // --- matching ---

    public void acceptBy(String acceptingProviderId, Instant now) {
        if (status != RequestStatus.SEARCHING) {
            throw new InvalidTransitionException("Request " + id + " is " + status + ", no longer open for acceptance");
        }
        if (isExcluded(acceptingProviderId)) {
            throw new InvalidTransitionException(
                    "Provider " + acceptingProviderId + " is excluded from request " + id);
        }
        providerId = acceptingProviderId;
        transitionTo(RequestStatus.ACCEPTED, null, now);
    }

    /** Exclusions only grow; there is no way to remove one. */
    public boolean excludeProvider(String excludedId, String reason, Instant now) {
        boolean added = excludedProviderIds.add(excludedId);
        if (added) {
            recordChange(reason, now);
        }
        return added;
    }

    /** The engaged provider leaves before a value was agreed; the request goes back to searching. */
    public String releaseProvider(String reason, Instant now) {
        if (status != RequestStatus.ACCEPTED && status != RequestStatus.NEGOTIATING) {
            throw new InvalidTransitionException("Provider cannot withdraw from request " + id + " in " + status);
        }
        if (valueAccepted) {
            throw new InvalidTransitionException(
                    "Value already agreed on request " + id + "; the provider must cancel instead");
        }
        String released = providerId;
        excludedProviderIds.add(released);
        providerId = null;
        proposedValue = null;
        lastProposalBy = null;
        directPayment = false;
        transitionTo(RequestStatus.SEARCHING, reason, now);
        return released;
    }

    // --- negotiation ---

    public void recordProposal(BigDecimal value, Party side, String reason, Instant now) {
        if (valueAccepted) {
            throw new IllegalStateException("Agreed value on request " + id + " is frozen");
        }
        proposedValue = value;
        lastProposalBy = side;
        recordChange(reason, now);
    }

    public void freezeAgreedValue(String reason, Instant now) {
        if (valueAccepted || agreedValue != null) {
            throw new IllegalStateException("Agreed value on request " + id + " is already set");
        }
        valueAccepted = true;
        agreedValue = proposedValue;
        recordChange(reason, now);
    }

    public void markDirectPayment(boolean enabled, String reason, Instant now) {
        if (directPayment == enabled) {
            return;
        }
        directPayment = enabled;
        recordChange(reason, now);
    }

    // --- payment ---

    public void startPayment(PaymentMethod method, String reason, Instant now) {
        if (status != RequestStatus.AWAITING_PAYMENT || paymentConfirmed) {
            throw new InvalidTransitionException("Request " + id + " is not awaiting payment");
        }
        paymentMethod = method;
        paymentStatus = PaymentStatus.PENDING;
        recordChange(reason, now);
    }

    public void markPaymentStatus(PaymentStatus next, String reason, Instant now) {
        if (paymentStatus == next) {
            return;
        }
        paymentStatus = next;
        recordChange(reason, now);
    }

    public void confirmPayment(String reason, Instant now) {
        if (paymentConfirmed) {
            throw new IllegalStateException("Payment on request " + id + " was already confirmed");
        }
        transitionTo(RequestStatus.IN_SERVICE, reason, now);
        paymentConfirmed = true;
        paymentStatus = PaymentStatus.CONFIRMED;
    }

    // --- completion ---

    public void requestCompletion(Instant now) {
        transitionTo(RequestStatus.PENDING_CLIENT_CONFIRMATION, null, now);
        providerFinishRequestedAt = updatedAt;
    }

    public void disputeCompletion(String reason, Instant now) {
        transitionTo(RequestStatus.IN_SERVICE, reason, now);
        providerFinishRequestedAt = null;
    }

    public void finish(String autoReason, Instant now) {
        transitionTo(RequestStatus.FINISHED, autoReason != null ? RequestStatusChangedEvent.REASON_AUTO_FINISHED : null, now);
        finishedAt = updatedAt;
        autoFinishReason = autoReason;
    }

    public void cancel(Party by, CancelReasonCategory category, String text, Instant now) {
        if (!status.isCancelable()) {
            throw new InvalidTransitionException("Request " + id + " cannot be canceled in " + status);
        }
        transitionTo(RequestStatus.CANCELED, category.name(), now);
        canceledBy = by;
        cancelReasonCategory = category;
        cancelReasonText = text;
        canceledAt = updatedAt;
    }
}
