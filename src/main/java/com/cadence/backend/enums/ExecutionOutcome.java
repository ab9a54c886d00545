package com.cadence.backend.enums;

/**
 * What happened to a claimed step once its adapter call settled.
 */
public enum ExecutionOutcome {
    SENT,
    COMPLETED,
    FAILED,
    DEFERRED,
    /** Adapter did not answer in time; the step stays EXECUTING until a stale reset. */
    TIMED_OUT,
    /** Worker pool was full; the claim went back to PENDING untouched for the next pass. */
    RELEASED,
    /** The step left EXECUTING before the outcome arrived, so the outcome was dropped. */
    DISCARDED;

    public static ExecutionOutcome fromStatus(StepStatus status) {
        return status == StepStatus.COMPLETED ? COMPLETED : SENT;
    }
}
