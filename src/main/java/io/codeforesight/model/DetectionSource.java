package io.codeforesight.model;

/**
 * Which detection strategy produced a finding.
 */
public enum DetectionSource {
    RULE("rule"),
    CLASSIFIER("classifier"),
    /**
     * A rule finding confirmed by the classifier on the same location and category.
     */
    MERGED("rule+classifier"),
    REASONING("reasoning");

    private final String id;

    DetectionSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
