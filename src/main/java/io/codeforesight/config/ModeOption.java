package io.codeforesight.config;

import java.util.Locale;

/**
 * Enumerated run mode options, as accepted from the CLI or a CI caller.
 */
public enum ModeOption {
    FULL("full"),
    STAGE1_ONLY("stage1_only"),
    STAGE2_ONLY("stage2_only"),
    STAGE3_ONLY("stage3_only"),
    /**
     * Route Stage 1 through the reasoning backend instead of rules and classifier.
     */
    LLM_ONLY("llm_only"),
    /**
     * Attach natural-language rationale to Stage 1 findings and the Stage 3 forecast.
     */
    EXPLAIN("explain");

    private final String id;

    ModeOption(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isStageSelector() {
        return this == STAGE1_ONLY || this == STAGE2_ONLY || this == STAGE3_ONLY;
    }

    public static ModeOption parse(String value) throws ConfigException {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ModeOption option : values()) {
            if (option.id.equals(v)) {
                return option;
            }
        }
        throw new ConfigException("Unknown mode option: " + value);
    }
}
