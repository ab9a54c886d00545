package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.StepPerformance;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class StepAnalysis {
    private int stepIndex;
    private int stepNumber;
    private Channel channel;
    private StepPerformance performance;
    private int healthScore;
    private List<String> issues;
    private List<StepRecommendation> recommendations;
}
