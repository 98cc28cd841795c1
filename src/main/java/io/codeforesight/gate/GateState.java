package io.codeforesight.gate;

/**
 * States of one orchestrated run.
 */
public enum GateState {
    READY,
    STAGE1_RUNNING,
    STAGE2_RUNNING,
    STAGE3_RUNNING,
    DONE
}
