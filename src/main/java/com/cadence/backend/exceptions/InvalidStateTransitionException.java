package com.cadence.backend.exceptions;

import com.cadence.backend.enums.StepStatus;

/**
 * Thrown when an operator transition is requested on a step that is not in the
 * state the transition starts from (approving a step that was already sent, for example).
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final Long stepId;
    private final StepStatus currentStatus;
    private final StepStatus requiredStatus;

    public InvalidStateTransitionException(Long stepId, StepStatus currentStatus, StepStatus requiredStatus) {
        super(String.format("Step %d is %s, expected %s", stepId, currentStatus, requiredStatus));
        this.stepId = stepId;
        this.currentStatus = currentStatus;
        this.requiredStatus = requiredStatus;
    }

    public Long getStepId() {
        return stepId;
    }

    public StepStatus getCurrentStatus() {
        return currentStatus;
    }

    public StepStatus getRequiredStatus() {
        return requiredStatus;
    }
}
