package com.cadence.backend.dto.campaign.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScheduleStepsResultDto {
    private Long campaignId;
    private int requested;
    private int inserted;
    private int skippedDuplicates;
}
