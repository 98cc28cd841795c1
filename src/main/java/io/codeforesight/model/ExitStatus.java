package io.codeforesight.model;

/**
 * Process exit codes consumed by CI gate scripts.
 */
public enum ExitStatus {
    PASS(0, "All configured gates passed"),
    FATAL(1, "Fatal error, no report produced"),
    CONFIG_ERROR(2, "Invalid usage or configuration"),
    INDETERMINATE(3, "A gate could not reach a verdict"),
    STAGE1_BLOCKED(10, "Stage 1 blocked: known vulnerability"),
    STAGE2_BLOCKED(20, "Stage 2 blocked: business-logic flaw"),
    STAGE3_BLOCKED(30, "Stage 3 blocked: forecast risk above threshold");

    private final int code;
    private final String description;

    ExitStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
