package com.cadence.backend.enums;

public enum RecommendationPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
