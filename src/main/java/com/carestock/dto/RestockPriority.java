package com.carestock.dto;

public enum RestockPriority {
    CRITICAL,
    HIGH,
    NORMAL;

    public static RestockPriority fromTier(UrgencyTier tier) {
        return switch (tier) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case NORMAL, UNKNOWN -> NORMAL;
        };
    }
}
