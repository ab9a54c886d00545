package com.cadence.backend.enums;

public enum OverallHealth {
    HEALTHY,
    NEEDS_ATTENTION,
    AT_RISK,
    CRITICAL;

    public static OverallHealth fromAverage(double averageScore) {
        if (averageScore >= 80) return HEALTHY;
        if (averageScore >= 60) return NEEDS_ATTENTION;
        if (averageScore >= 40) return AT_RISK;
        return CRITICAL;
    }
}
