package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.InsightType;
import com.cadence.backend.enums.RecommendationPriority;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Insight {
    private InsightType type;
    private String title;
    private String description;
    private RecommendationPriority priority;
}
