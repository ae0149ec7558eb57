package com.roadside.request.negotiation;

import com.roadside.request.entity.ChatMessage;
import com.roadside.request.entity.ServiceRequest;
import com.roadside.request.exception.InvalidTransitionException;
import com.roadside.request.exception.InvalidValueException;
import com.roadside.request.metrics.LifecycleMetrics;
import com.roadside.request.repository.ChatMessageRepository;
import com.roadside.shared.enums.Party;
import com.roadside.shared.enums.RequestStatus;
import com.roadside.shared.events.RequestStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * Turn-based price exchange between client and provider.
 *
 * Rules:
 *   - one outstanding proposal, owned by {@code lastProposalBy}
 *   - a side cannot propose twice in a row
 *   - a side accepts the other side's proposal, never its own
 *   - once accepted, the agreed value is frozen; further accepts are no-ops
 *
 * Every check runs before the request is touched. Callers hold the request
 * lock (see RequestStateMachine), so moves are applied in arrival order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NegotiationProtocol {

    static final BigDecimal MAX_VALUE = new BigDecimal("100000.00");

    private final ChatMessageRepository chatMessageRepository;
    private final LifecycleMetrics metrics;

    public void propose(ServiceRequest request, BigDecimal rawValue, Party side, String actorId, Instant now) {
        BigDecimal value = normalize(rawValue);
        RequestStatus status = request.getStatus();
        if (status != RequestStatus.ACCEPTED && status != RequestStatus.NEGOTIATING) {
            throw new InvalidTransitionException("Request " + request.getId() + " is not open for negotiation (" + status + ")");
        }
        if (request.isValueAccepted()) {
            throw new InvalidTransitionException("Value on request " + request.getId() + " is already agreed");
        }
        if (side == request.getLastProposalBy()) {
            throw new InvalidTransitionException(
                    "Waiting for the " + side.counterpart().name().toLowerCase(Locale.ROOT) + " to respond on request " + request.getId());
        }
        if (status == RequestStatus.ACCEPTED) {
            request.transitionTo(RequestStatus.NEGOTIATING, null, now);
        }
        request.recordProposal(value, side, RequestStatusChangedEvent.REASON_PROPOSAL, now);
        systemEntry(request, actorId, "Proposed value: " + formatBrl(value), now);
        metrics.recordProposal();
        log.info("Request {}: {} proposed {}", request.getId(), side, value);
    }

    /**
     * Accepts the other side's outstanding proposal.
     *
     * @return false when the value was already accepted (nothing changed)
     */
    public boolean accept(ServiceRequest request, Party side, String actorId, Instant now) {
        if (request.isValueAccepted()) {
            return false;
        }
        if (request.getStatus() != RequestStatus.NEGOTIATING) {
            throw new InvalidTransitionException("Request " + request.getId() + " has no negotiation in progress");
        }
        if (request.getProposedValue() == null) {
            throw new InvalidTransitionException("Nothing has been proposed on request " + request.getId());
        }
        if (side == request.getLastProposalBy()) {
            throw new InvalidTransitionException("A side cannot accept its own proposal on request " + request.getId());
        }
        request.freezeAgreedValue(RequestStatusChangedEvent.REASON_VALUE_ACCEPTED, now);
        systemEntry(request, actorId, "Value accepted: " + formatBrl(request.getAgreedValue()), now);
        metrics.recordValueAgreed();
        log.info("Request {}: value {} agreed by {}", request.getId(), request.getAgreedValue(), side);
        return true;
    }

    /** Settlement outside the platform. Only between acceptance and confirmAndProceed. */
    public void setDirectPayment(ServiceRequest request, boolean enabled, Instant now) {
        if (!request.isValueAccepted() || request.getStatus() != RequestStatus.NEGOTIATING) {
            throw new InvalidTransitionException(
                    "Direct payment can only be set after the value is agreed and before confirming request " + request.getId());
        }
        request.markDirectPayment(enabled, "direct_payment_" + (enabled ? "on" : "off"), now);
    }

    /** The only way into AWAITING_PAYMENT. */
    public void confirmAndProceed(ServiceRequest request, Instant now) {
        if (request.getStatus() != RequestStatus.NEGOTIATING || !request.isValueAccepted()) {
            throw new InvalidTransitionException(
                    "Request " + request.getId() + " cannot proceed to payment before a value is agreed");
        }
        request.transitionTo(RequestStatus.AWAITING_PAYMENT, null, now);
    }

    static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            throw new InvalidValueException("Proposed value is required");
        }
        if (value.signum() <= 0) {
            throw new InvalidValueException("Proposed value must be positive, got " + value.toPlainString());
        }
        BigDecimal scaled = value.setScale(2, RoundingMode.HALF_UP);
        if (scaled.signum() <= 0) {
            throw new InvalidValueException("Proposed value rounds to zero: " + value.toPlainString());
        }
        if (scaled.compareTo(MAX_VALUE) > 0) {
            throw new InvalidValueException("Proposed value exceeds " + MAX_VALUE.toPlainString());
        }
        return scaled;
    }

    static String formatBrl(BigDecimal value) {
        return "R$ " + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private void systemEntry(ServiceRequest request, String actorId, String message, Instant now) {
        chatMessageRepository.save(ChatMessage.builder()
                .requestId(request.getId())
                .senderType(Party.SYSTEM)
                .senderId(actorId)
                .message(message)
                .createdAt(now)
                .build());
    }
}
