package com.todotracker.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Priority attached to a finding through its annotated field group, e.g. {@code TODO(p:high)}.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Classifies a single metadata token as a priority.
     *
     * <p>Accepts bare level names ({@code high}), the {@code p:} prefixed form
     * ({@code p:high}), the short forms {@code med} and {@code crit}, and the numeric
     * {@code p0}..{@code p3} scale where {@code p0} is the most urgent.
     *
     * @param token trimmed metadata token
     * @return matching priority, or empty if the token is not a priority
     */
    public static Optional<Priority> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "low", "p:low", "p3" -> Optional.of(LOW);
            case "medium", "med", "p:medium", "p:med", "p2" -> Optional.of(MEDIUM);
            case "high", "p:high", "p1" -> Optional.of(HIGH);
            case "critical", "crit", "p:critical", "p:crit", "p0" -> Optional.of(CRITICAL);
            default -> Optional.empty();
        };
    }
}
