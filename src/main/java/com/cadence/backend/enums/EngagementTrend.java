package com.cadence.backend.enums;

public enum EngagementTrend {
    IMPROVING,
    STABLE,
    DECLINING
}
