package com.cadence.backend.enums;

public enum EngagementEventType {
    SENT,
    DELIVERED,
    OPENED,
    CLICKED,
    REPLIED,
    BOUNCED,
    UNSUBSCRIBED
}
