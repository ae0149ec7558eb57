package com.roadside.shared.enums;

public enum SearchState {
    IDLE,
    SEARCHING,
    EXPANDING_RADIUS,
    WAITING_COOLDOWN,
    PROVIDER_FOUND,
    TIMEOUT,
    CANCELED;

    public boolean isFinal() {
        return this == TIMEOUT || this == CANCELED;
    }
}
