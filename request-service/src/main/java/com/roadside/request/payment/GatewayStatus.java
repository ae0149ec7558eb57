package com.roadside.request.payment;

/** Settlement status as the gateway reports it. */
public enum GatewayStatus {
    PENDING,
    PAID,
    FAILED;

    public boolean isSettled() {
        return this != PENDING;
    }
}
