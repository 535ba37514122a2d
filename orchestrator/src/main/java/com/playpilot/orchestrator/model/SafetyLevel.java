package com.playpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller-chosen strictness tier for the safety policy.
 *
 * LOW     accept at score 50, unrestricted modules only warn
 * MEDIUM  accept at score 70, unrestricted modules only warn
 * HIGH    accept at score 90 with zero violations; shell/command modules
 *          and elevated privilege are violations
 */
public enum SafetyLevel {
    LOW(50, false),
    MEDIUM(70, false),
    HIGH(90, true);

    private final int     acceptanceThreshold;
    private final boolean strict;

    SafetyLevel(int acceptanceThreshold, boolean strict) {
        this.acceptanceThreshold = acceptanceThreshold;
        this.strict              = strict;
    }

    public int     acceptanceThreshold() { return acceptanceThreshold; }
    public boolean strict()              { return strict; }

    @JsonCreator
    public static SafetyLevel from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown safety level: '" + value + "' (expected low, medium or high)");
        }
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
