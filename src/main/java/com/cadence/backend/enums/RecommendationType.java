package com.cadence.backend.enums;

public enum RecommendationType {
    TIMING,
    CONTENT,
    TARGETING,
    ADJUST,
    PAUSE,
    SKIP_STEP
}
