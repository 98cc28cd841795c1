package io.codeforesight.model;

/**
 * Outcome of a single gate.
 */
public enum Verdict {
    PASS("pass"),
    BLOCK("block"),
    /**
     * Neither pass nor block could be established because an external dependency failed.
     */
    INDETERMINATE("indeterminate"),
    /**
     * The stage was not selected by the mode or was not reached.
     */
    SKIPPED("skipped");

    private final String id;

    Verdict(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * True for verdicts that let the pipeline continue to the next stage.
     */
    public boolean allowsNextStage() {
        return this == PASS || this == INDETERMINATE;
    }
}
