package com.roadside.shared.enums;

public enum PaymentMethod {
    CARD,
    WALLET,
    INSTANT_TRANSFER,
    DIRECT_TO_PROVIDER;

    /** Instant transfers are confirmed out-of-band by the gateway (push or poll). */
    public boolean confirmsAsynchronously() {
        return this == INSTANT_TRANSFER;
    }

    public boolean settlesOffPlatform() {
        return this == DIRECT_TO_PROVIDER;
    }
}
