package io.codeforesight.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Vulnerability or flaw class a finding belongs to.
 */
public enum Category {
    BUFFER_OVERFLOW("buffer-overflow", Severity.HIGH,
            List.of("CWE-120", "CWE-119", "CWE-121", "CWE-122", "CWE-787", "CWE-805", "CWE-416")),
    INJECTION("injection", Severity.HIGH,
            List.of("CWE-89", "CWE-77", "CWE-90", "CWE-943")),
    COMMAND_INJECTION("command-injection", Severity.HIGH,
            List.of("CWE-78")),
    CODE_EXECUTION("code-execution", Severity.HIGH,
            List.of("CWE-94", "CWE-95")),
    XSS("xss", Severity.MEDIUM,
            List.of("CWE-79", "CWE-80", "CWE-83")),
    PATH_TRAVERSAL("path-traversal", Severity.MEDIUM,
            List.of("CWE-22", "CWE-23", "CWE-35")),
    DESERIALIZATION("deserialization", Severity.HIGH,
            List.of("CWE-502")),
    CREDENTIALS("hardcoded-credentials", Severity.MEDIUM,
            List.of("CWE-798", "CWE-259")),
    AUTHZ("authorization", Severity.HIGH,
            List.of("CWE-862", "CWE-863", "CWE-287", "CWE-306")),
    CRYPTO("crypto", Severity.MEDIUM,
            List.of("CWE-319", "CWE-326", "CWE-327")),
    INFO_DISCLOSURE("info-disclosure", Severity.LOW,
            List.of("CWE-200", "CWE-201")),
    BUSINESS_LOGIC("business-logic", Severity.HIGH,
            List.of("CWE-840", "CWE-841")),
    OTHER("other", Severity.MEDIUM, List.of());

    private static final Map<String, Category> BY_ID;

    static {
        Map<String, Category> ids = new HashMap<>();
        for (Category c : values()) {
            ids.put(c.id, c);
        }
        BY_ID = Map.copyOf(ids);
    }

    private final String id;
    private final Severity defaultSeverity;
    private final List<String> cweIds;

    Category(String id, Severity defaultSeverity, List<String> cweIds) {
        this.id = id;
        this.defaultSeverity = defaultSeverity;
        this.cweIds = cweIds;
    }

    /**
     * Stable identifier used in reports, rules and artifacts (e.g. "buffer-overflow").
     */
    public String id() {
        return id;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * CWE ids grouped under this category, most representative first.
     */
    public List<String> cweIds() {
        return cweIds;
    }

    /**
     * Most representative CWE id, or null for OTHER.
     */
    public String primaryCwe() {
        return cweIds.isEmpty() ? null : cweIds.get(0);
    }

    /**
     * Resolves a category from its id, its enum name or a CWE id.
     * Returns OTHER for anything unrecognised.
     */
    public static Category fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String trimmed = label.trim();
        Category byId = BY_ID.get(trimmed.toLowerCase(Locale.ROOT));
        if (byId != null) {
            return byId;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.name().equals(upper.replace('-', '_'))) {
                return c;
            }
        }
        return fromCwe(upper);
    }

    /**
     * Maps a CWE id ("CWE-120") to its category group.
     */
    public static Category fromCwe(String cweId) {
        if (cweId == null) {
            return OTHER;
        }
        String normalized = cweId.trim().toUpperCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.cweIds.contains(normalized)) {
                return c;
            }
        }
        return OTHER;
    }
}
