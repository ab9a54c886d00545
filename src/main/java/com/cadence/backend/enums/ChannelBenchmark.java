package com.cadence.backend.enums;

/**
 * Static reference rates (percent) per channel family. Comparison baseline only.
 */
public enum ChannelBenchmark {
    EMAIL(25, 3, 2, 2),
    LINKEDIN(45, 8, 5, 0),
    SMS(98, 15, 8, 1),
    PHONE(0, 0, 25, 0),
    VOICEMAIL(70, 0, 10, 0);

    private final int openRate;
    private final int clickRate;
    private final int replyRate;
    private final int bounceRate;

    ChannelBenchmark(int openRate, int clickRate, int replyRate, int bounceRate) {
        this.openRate = openRate;
        this.clickRate = clickRate;
        this.replyRate = replyRate;
        this.bounceRate = bounceRate;
    }

    public int getOpenRate() {
        return openRate;
    }

    public int getClickRate() {
        return clickRate;
    }

    public int getReplyRate() {
        return replyRate;
    }

    public int getBounceRate() {
        return bounceRate;
    }

    public static ChannelBenchmark forChannel(Channel channel) {
        if (channel == null) {
            return EMAIL;
        }
        return switch (channel) {
            case LINKEDIN_CONNECTION, LINKEDIN_MESSAGE -> LINKEDIN;
            case EMAIL -> EMAIL;
            case SMS -> SMS;
            case PHONE -> PHONE;
            case VOICEMAIL -> VOICEMAIL;
        };
    }
}
