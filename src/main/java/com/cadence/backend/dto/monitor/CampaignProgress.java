package com.cadence.backend.dto.monitor;

import com.cadence.backend.enums.StepStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class CampaignProgress {
    private Long campaignId;
    private String campaignName;
    private int totalContacts;
    private int contactsInProgress;
    private int contactsCompleted;
    private int contactsOptedOut;
    private int contactsReplied;
    private int currentStep;
    private int totalSteps;
    private int progressPercent;
    private Instant startedAt;
    private Instant estimatedCompletion;
    private Map<StepStatus, Long> statusCounts;
    private List<FailureBreakdown> failureBreakdown;
    private List<StepMetrics> steps;
}
