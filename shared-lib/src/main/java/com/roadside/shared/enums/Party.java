package com.roadside.shared.enums;

public enum Party {
    CLIENT,
    PROVIDER,
    SYSTEM;

    public Party counterpart() {
        return switch (this) {
            case CLIENT -> PROVIDER;
            case PROVIDER -> CLIENT;
            case SYSTEM -> SYSTEM;
        };
    }
}
