package com.roadside.shared.enums;

public enum ServiceType {
    TOWING(true),
    TIRE(false),
    MECHANICAL(false),
    LOCKSMITH(false);

    private final boolean requiresDestination;

    ServiceType(boolean requiresDestination) {
        this.requiresDestination = requiresDestination;
    }

    /** Only towing moves the vehicle, so only towing needs a drop-off point. */
    public boolean requiresDestination() {
        return requiresDestination;
    }
}
