package com.cadence.backend.dto.campaign.response;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
public class WarmupRescheduleResultDto {
    private Long campaignId;
    private int rescheduledCount;
    private int warmupDay;
    private int dailyLimit;
    private int sentToday;
    private int daysSpanned;
    private Map<LocalDate, Integer> perDay;
}
