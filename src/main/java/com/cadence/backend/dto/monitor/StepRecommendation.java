package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.RecommendationType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StepRecommendation {
    private RecommendationType type;
    private RecommendationPriority priority;
    private String suggestion;
    private String rationale;
    private String estimatedImpact;
}
