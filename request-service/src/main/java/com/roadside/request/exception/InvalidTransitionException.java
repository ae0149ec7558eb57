package com.roadside.request.exception;

/**
 * A status change or negotiation move that the current state does not allow.
 * Always thrown before anything is mutated.
 */
public class InvalidTransitionException extends RequestException {

    public static final String CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String message) {
        super(CODE, message);
    }
}
