package com.roadside.request.entity;

import com.roadside.shared.enums.RequestStatus;

import java.time.Instant;

/**
 * One broadcastable change recorded on a {@link ServiceRequest} during a mutation.
 * {@code from == to} for sub-state changes that do not move the status.
 */
public record RequestChange(RequestStatus from, RequestStatus to, String reason, Instant at) {

    public boolean isTransition() {
        return from != to;
    }
}
