package com.cadence.backend.enums;

public enum Channel {
    LINKEDIN_CONNECTION("LinkedIn Connection", true, false, 70),
    LINKEDIN_MESSAGE("LinkedIn Message", true, false, 75),
    EMAIL("Email", false, false, 90),
    SMS("SMS", false, false, 85),
    PHONE("Phone", false, true, 65),
    VOICEMAIL("Voicemail", false, true, 65);

    private final String displayName;
    private final boolean warmupLimited;
    private final boolean instantaneous;
    private final int defaultConfidence;

    Channel(String displayName, boolean warmupLimited, boolean instantaneous, int defaultConfidence) {
        this.displayName = displayName;
        this.warmupLimited = warmupLimited;
        this.instantaneous = instantaneous;
        this.defaultConfidence = defaultConfidence;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * LinkedIn actions go through the warmup rate limiter before execution.
     */
    public boolean isWarmupLimited() {
        return warmupLimited;
    }

    /**
     * Channels whose successful execution is already the final outcome
     * (a placed call), so the step lands in COMPLETED instead of SENT.
     */
    public boolean isInstantaneous() {
        return instantaneous;
    }

    public int getDefaultConfidence() {
        return defaultConfidence;
    }

    public boolean isLinkedIn() {
        return this == LINKEDIN_CONNECTION || this == LINKEDIN_MESSAGE;
    }

    public StepStatus successStatus() {
        return instantaneous ? StepStatus.COMPLETED : StepStatus.SENT;
    }
}
