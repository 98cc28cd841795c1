package io.codeforesight.model;

/**
 * The three gates of the pipeline.
 */
public enum Stage {
    STAGE1("stage1", "S1", "Known vulnerabilities", ExitStatus.STAGE1_BLOCKED),
    STAGE2("stage2", "S2", "Business-logic flaws", ExitStatus.STAGE2_BLOCKED),
    STAGE3("stage3", "S3", "Risk forecast", ExitStatus.STAGE3_BLOCKED);

    private final String id;
    private final String idPrefix;
    private final String displayName;
    private final ExitStatus blockedStatus;

    Stage(String id, String idPrefix, String displayName, ExitStatus blockedStatus) {
        this.id = id;
        this.idPrefix = idPrefix;
        this.displayName = displayName;
        this.blockedStatus = blockedStatus;
    }

    public String id() {
        return id;
    }

    /**
     * Prefix of finding ids emitted by this stage ("S1-0001").
     */
    public String idPrefix() {
        return idPrefix;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Exit status reported when this stage blocks the run.
     */
    public ExitStatus blockedStatus() {
        return blockedStatus;
    }
}
