package com.cadence.backend.dto.monitor;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class InsightReport {
    private Long campaignId;
    private String summary;
    private List<Insight> insights;
    private InsightMetrics metrics;
}
