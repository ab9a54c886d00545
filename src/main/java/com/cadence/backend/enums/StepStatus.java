package com.cadence.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum StepStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    REQUIRES_APPROVAL("Needs Approval"),
    EXECUTING("Executing"),
    SENT("Sent"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    SKIPPED("Skipped"),
    // Never written by the scheduler: a warmup deferral returns the step to PENDING
    DEFERRED("Deferred");

    /**
     * Statuses the scheduler picks up once scheduledAt has passed.
     */
    public static final Set<StepStatus> SCHEDULABLE = EnumSet.of(PENDING, APPROVED);

    /**
     * Statuses that count against the daily warmup window.
     */
    public static final Set<StepStatus> EXECUTED = EnumSet.of(SENT, COMPLETED);

    private final String displayName;

    StepStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isSuccessful() {
        return this == SENT || this == COMPLETED;
    }

    public boolean isSchedulable() {
        return SCHEDULABLE.contains(this);
    }
}
