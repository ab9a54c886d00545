package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.EngagementTrend;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HealthInsights {
    private StepHighlight topPerformingStep;
    private StepHighlight bottomPerformingStep;
    private Channel bestChannel;
    private EngagementTrend engagementTrend;
    private int projectedCompletionRate;
}
