package com.cadence.backend.enums;

public enum InsightType {
    RECOMMENDATION,
    OPPORTUNITY,
    WARNING,
    ACHIEVEMENT
}
