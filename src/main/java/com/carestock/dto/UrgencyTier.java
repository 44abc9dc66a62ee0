package com.carestock.dto;

import java.util.Locale;

/**
 * How soon something needs attention. Shared by the depletion forecast and the
 * triage proxy so operators see one vocabulary.
 */
public enum UrgencyTier {
    UNKNOWN(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int severity;

    UrgencyTier(int severity) {
        this.severity = severity;
    }

    /** UNKNOWN is never at least anything, including itself. */
    public boolean isAtLeast(UrgencyTier other) {
        return this != UNKNOWN && other != UNKNOWN && severity >= other.severity;
    }

    public static UrgencyTier fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "severe", "emergency" -> CRITICAL;
            case "high", "moderate", "urgent", "acute", "medium" -> HIGH;
            case "normal", "mild", "low", "routine", "follow-up" -> NORMAL;
            default -> UNKNOWN;
        };
    }
}
