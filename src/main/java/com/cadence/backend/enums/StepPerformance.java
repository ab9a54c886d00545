package com.cadence.backend.enums;

public enum StepPerformance {
    EXCELLENT,
    GOOD,
    AVERAGE,
    BELOW_AVERAGE,
    POOR;

    public static StepPerformance fromScore(int healthScore) {
        if (healthScore >= 90) return EXCELLENT;
        if (healthScore >= 75) return GOOD;
        if (healthScore >= 60) return AVERAGE;
        if (healthScore >= 40) return BELOW_AVERAGE;
        return POOR;
    }

    public boolean isUnderperforming() {
        return this == BELOW_AVERAGE || this == POOR;
    }
}
