package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.OverallHealth;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class CampaignHealthReport {
    private Long campaignId;
    private OverallHealth overallHealth;
    private int overallScore;
    private CampaignProgress progress;
    private List<StepAnalysis> stepAnalysis;
    private List<CampaignRecommendation> recommendations;
    private HealthInsights insights;
    private String summary;
    private Instant generatedAt;
}
