package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.RecommendationType;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CampaignRecommendation {
    private RecommendationType type;
    private RecommendationPriority priority;
    private String title;
    private String description;
    private List<Integer> affectedSteps; // step numbers, 1-based
}
