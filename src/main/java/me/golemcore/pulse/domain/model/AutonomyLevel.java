package me.golemcore.pulse.domain.model;

import java.util.Locale;

/**
 * How much an agent may do without a human. Ordered from least to most
 * autonomous.
 */
public enum AutonomyLevel {

    /** Watches and reports only. */
    OBSERVER,
    /** Suggests, every action needs approval. */
    ADVISOR,
    /** Acts on low-risk items, the rest needs approval. */
    COPILOT,
    /** Acts without approval. */
    AUTOPILOT;

    public boolean isAtLeast(AutonomyLevel other) {
        return ordinal() >= other.ordinal();
    }

    public static AutonomyLevel parse(String value, AutonomyLevel fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.chars().allMatch(Character::isDigit)) {
            int ordinal = Integer.parseInt(normalized);
            AutonomyLevel[] levels = values();
            return ordinal >= 0 && ordinal < levels.length ? levels[ordinal] : fallback;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
