package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.Channel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate engagement counts for one step index of a campaign. Rates are whole percents of {@code sent}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepMetrics {
    private int stepIndex;
    private Channel channel;
    private long sent;
    private long delivered;
    private long opened;
    private long clicked;
    private long replied;
    private long bounced;
    private long unsubscribed;

    public int getStepNumber() {
        return stepIndex + 1;
    }

    public int getOpenRate() {
        return rate(opened);
    }

    public int getClickRate() {
        return rate(clicked);
    }

    public int getReplyRate() {
        return rate(replied);
    }

    public int getBounceRate() {
        return rate(bounced);
    }

    private int rate(long count) {
        if (sent == 0) {
            return 0;
        }
        return (int) Math.round(100.0 * count / sent);
    }
}
