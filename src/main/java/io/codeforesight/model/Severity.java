package io.codeforesight.model;

import java.util.Locale;

/**
 * Severity levels for findings.
 * Higher severity = more damage if the flaw is exploited.
 */
public enum Severity {
    /**
     * Critical - exploitable with little effort, full compromise likely.
     */
    CRITICAL(1, "CRITICAL"),

    /**
     * High - memory corruption, injection, missing authorization.
     */
    HIGH(2, "HIGH"),

    /**
     * Medium - exploitable under specific conditions.
     * Examples: path traversal patterns, markup interpolation.
     */
    MEDIUM(3, "MEDIUM"),

    /**
     * Low - hardening opportunity.
     */
    LOW(4, "LOW"),

    /**
     * Informational - documented for completeness.
     */
    INFO(5, "INFO");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a severity label ("high", "MEDIUM", ...). Unknown values map to MEDIUM.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            case "low" -> LOW;
            case "info" -> INFO;
            default -> MEDIUM;
        };
    }
}
