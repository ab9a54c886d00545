package com.cadence.backend.services.campaign;

import com.cadence.backend.dto.campaign.response.WarmupRescheduleResultDto;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Spreads a campaign's pending connection requests over the coming days so each day
 * stays within the account's warmup limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WarmupRescheduleService {

    private final StepStore stepStore;
    private final WarmupRateLimiter rateLimiter;
    private final WarmupPolicy warmupPolicy;
    private final SendWindowPlanner sendWindowPlanner;
    private final Clock clock;

    public WarmupRescheduleResultDto rescheduleWarmup(Long campaignId) {
        Instant now = clock.instant();
        List<ScheduledStep> pending = stepStore.findPending(campaignId, Channel.LINKEDIN_CONNECTION);

        Map<Long, List<ScheduledStep>> byAccount = pending.stream()
                .collect(Collectors.groupingBy(ScheduledStep::getWorkspaceId, LinkedHashMap::new, Collectors.toList()));

        Map<LocalDate, Integer> perDay = new TreeMap<>();
        WarmupRateLimiter.WarmupSnapshot reported = null;
        int rescheduled = 0;

        for (Map.Entry<Long, List<ScheduledStep>> entry : byAccount.entrySet()) {
            WarmupRateLimiter.WarmupSnapshot snapshot = rateLimiter.snapshot(entry.getKey(), now);
            if (reported == null) {
                reported = snapshot;
            }
            rescheduled += spread(entry.getValue(), snapshot, now, perDay);
        }

        log.info("Rescheduled {} pending connection requests for campaign {} over {} day(s)",
                rescheduled, campaignId, perDay.size());

        return WarmupRescheduleResultDto.builder()
                .campaignId(campaignId)
                .rescheduledCount(rescheduled)
                .warmupDay(reported != null ? reported.warmupDay() : 0)
                .dailyLimit(reported != null ? reported.dailyLimit() : warmupPolicy.dailyLimit(0))
                .sentToday(reported != null ? reported.sentToday() : 0)
                .daysSpanned(perDay.size())
                .perDay(perDay)
                .build();
    }

    private int spread(List<ScheduledStep> steps, WarmupRateLimiter.WarmupSnapshot snapshot,
                       Instant now, Map<LocalDate, Integer> perDay) {
        LocalDate today = sendWindowPlanner.today(now);
        int dayOffset = 0;
        int capacity = snapshot.remainingToday();
        if (!sendWindowPlanner.hasWindowRemaining(today, now)) {
            capacity = 0;
        }

        int moved = 0;
        for (ScheduledStep step : steps) {
            while (capacity <= 0) {
                dayOffset++;
                capacity = warmupPolicy.dailyLimit(snapshot.warmupDay() + dayOffset);
            }
            LocalDate day = today.plusDays(dayOffset);
            Instant slot = sendWindowPlanner.randomTimeInBusinessWindow(day, now);

            if (stepStore.resetToPending(step.getId(), StepStatus.PENDING, slot, now)) {
                capacity--;
                moved++;
                perDay.merge(day, 1, Integer::sum);
            }
        }
        return moved;
    }
}
