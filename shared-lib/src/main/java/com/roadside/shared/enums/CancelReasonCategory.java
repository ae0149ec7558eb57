package com.roadside.shared.enums;

import java.util.EnumSet;
import java.util.Set;

public enum CancelReasonCategory {
    CHANGED_MIND(Party.CLIENT),
    FOUND_ALTERNATIVE(Party.CLIENT),
    WAIT_TIME_TOO_LONG(Party.CLIENT),
    PRICE_DISAGREEMENT(Party.CLIENT),
    EMERGENCY_RESOLVED(Party.CLIENT),
    UNAVAILABLE(Party.PROVIDER),
    LOCATION_TOO_FAR(Party.PROVIDER),
    VEHICLE_ISSUE(Party.PROVIDER),
    EMERGENCY(Party.PROVIDER),
    INCORRECT_INFO(Party.PROVIDER),
    SYSTEM_TIMEOUT(Party.SYSTEM),
    OTHER(Party.CLIENT, Party.PROVIDER);

    private final Set<Party> allowedFor;

    CancelReasonCategory(Party first, Party... rest) {
        this.allowedFor = EnumSet.of(first, rest);
    }

    public boolean isAllowedFor(Party party) {
        return allowedFor.contains(party);
    }
}
