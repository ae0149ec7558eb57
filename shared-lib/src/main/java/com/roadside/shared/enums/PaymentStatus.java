package com.roadside.shared.enums;

public enum PaymentStatus {
    NONE,
    PENDING,
    CONFIRMING,
    CONFIRMED,
    FAILED,
    SUPERSEDED,
    /** Captured by the gateway after the request was settled or canceled; the money must go back. */
    REFUND_REQUIRED
}
