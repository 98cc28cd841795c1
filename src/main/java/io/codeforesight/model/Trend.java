package io.codeforesight.model;

/**
 * Direction of the forecast risk over the configured horizon.
 */
public enum Trend {
    INCREASING("increasing"),
    STABLE("stable"),
    DECREASING("decreasing");

    private final String id;

    Trend(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
