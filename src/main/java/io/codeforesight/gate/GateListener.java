package io.codeforesight.gate;

import io.codeforesight.model.StageReport;

/**
 * Observes the progress of a run.
 */
public interface GateListener {

    GateListener NONE = new GateListener() {
    };

    default void onTransition(GateState state) {
    }

    default void onStageComplete(StageReport report) {
    }
}
