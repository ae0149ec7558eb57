package com.roadside.shared.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical status of a service request.
 *
 * The allowed edges are fixed here and nowhere else; every status change goes
 * through {@link #canTransitionTo(RequestStatus)}.
 *
 * <pre>
 * IDLE -> SEARCHING
 * SEARCHING -> ACCEPTED | CANCELED
 * ACCEPTED -> NEGOTIATING | SEARCHING (provider withdraws) | CANCELED
 * NEGOTIATING -> AWAITING_PAYMENT | SEARCHING (provider withdraws) | CANCELED
 * AWAITING_PAYMENT -> IN_SERVICE | CANCELED
 * IN_SERVICE -> PENDING_CLIENT_CONFIRMATION | CANCELED
 * PENDING_CLIENT_CONFIRMATION -> FINISHED | IN_SERVICE (client disputes)
 * </pre>
 */
public enum RequestStatus {
    IDLE,
    SEARCHING,
    ACCEPTED,
    NEGOTIATING,
    AWAITING_PAYMENT,
    IN_SERVICE,
    PENDING_CLIENT_CONFIRMATION,
    FINISHED,
    CANCELED;

    /** Older clients still send "confirmed" for a paid, running service. */
    private static final String LEGACY_CONFIRMED = "CONFIRMED";

    private static final Map<RequestStatus, Set<RequestStatus>> TRANSITIONS = new EnumMap<>(RequestStatus.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(SEARCHING));
        TRANSITIONS.put(SEARCHING, EnumSet.of(ACCEPTED, CANCELED));
        TRANSITIONS.put(ACCEPTED, EnumSet.of(NEGOTIATING, SEARCHING, CANCELED));
        TRANSITIONS.put(NEGOTIATING, EnumSet.of(AWAITING_PAYMENT, SEARCHING, CANCELED));
        TRANSITIONS.put(AWAITING_PAYMENT, EnumSet.of(IN_SERVICE, CANCELED));
        TRANSITIONS.put(IN_SERVICE, EnumSet.of(PENDING_CLIENT_CONFIRMATION, CANCELED));
        TRANSITIONS.put(PENDING_CLIENT_CONFIRMATION, EnumSet.of(FINISHED, IN_SERVICE));
        TRANSITIONS.put(FINISHED, EnumSet.noneOf(RequestStatus.class));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(RequestStatus.class));
    }

    public boolean canTransitionTo(RequestStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<RequestStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELED;
    }

    /** Statuses in which a provider is bound to the request. */
    public boolean hasEngagedProvider() {
        return this == ACCEPTED || this == NEGOTIATING || this == AWAITING_PAYMENT
                || this == IN_SERVICE || this == PENDING_CLIENT_CONFIRMATION;
    }

    public boolean isCancelable() {
        return this == SEARCHING || this == ACCEPTED || this == NEGOTIATING
                || this == AWAITING_PAYMENT || this == IN_SERVICE;
    }

    public static Set<RequestStatus> activeStatuses() {
        return EnumSet.of(SEARCHING, ACCEPTED, NEGOTIATING, AWAITING_PAYMENT, IN_SERVICE, PENDING_CLIENT_CONFIRMATION);
    }

    public static Set<RequestStatus> engagedStatuses() {
        return EnumSet.of(ACCEPTED, NEGOTIATING, AWAITING_PAYMENT, IN_SERVICE, PENDING_CLIENT_CONFIRMATION);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RequestStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (LEGACY_CONFIRMED.equals(normalized)) {
            return IN_SERVICE;
        }
        return RequestStatus.valueOf(normalized);
    }
}
