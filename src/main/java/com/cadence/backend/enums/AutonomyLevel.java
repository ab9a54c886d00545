package com.cadence.backend.enums;

public enum AutonomyLevel {
    MANUAL_APPROVAL,
    SEMI_AUTONOMOUS,
    FULLY_AUTONOMOUS
}
