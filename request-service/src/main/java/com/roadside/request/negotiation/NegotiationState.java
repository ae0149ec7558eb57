package com.roadside.request.negotiation;

import com.roadside.request.entity.ServiceRequest;
import com.roadside.shared.enums.Party;

import java.math.BigDecimal;

/**
 * Read-only view over a request's negotiation fields. Never persisted on its own.
 */
public record NegotiationState(BigDecimal proposedValue,
                               Party lastProposalBy,
                               boolean valueAccepted,
                               BigDecimal agreedValue,
                               boolean directPayment) {

    public static NegotiationState of(ServiceRequest request) {
        return new NegotiationState(
                request.getProposedValue(),
                request.getLastProposalBy(),
                request.isValueAccepted(),
                request.getAgreedValue(),
                request.isDirectPayment());
    }

    /** The side whose move it is, or null when nothing is on the table or the value is settled. */
    public Party awaitingResponseFrom() {
        if (valueAccepted || proposedValue == null || lastProposalBy == null) {
            return null;
        }
        return lastProposalBy.counterpart();
    }
}
