package com.cadence.backend.services.campaign;

import com.cadence.backend.config.OutreachProperties;
import com.cadence.backend.dto.campaign.response.WarmupRescheduleResultDto;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.InMemoryStepStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class WarmupRescheduleServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 13);
    private static final Long CAMPAIGN = 3L;

    private InMemoryStepStore stepStore;
    private long nextContact = 1;

    @BeforeEach
    void setUp() {
        stepStore = new InMemoryStepStore();
    }

    @Test
    void rescheduleWarmup_ShouldFillEachDayUpToItsLimit() {
        // Given - fresh account, warmup day 0
        List<ScheduledStep> pending = savePending(12);

        // When
        WarmupRescheduleResultDto result = service(NOW).rescheduleWarmup(CAMPAIGN);

        // Then
        assertThat(result.getRescheduledCount()).isEqualTo(12);
        assertThat(result.getWarmupDay()).isZero();
        assertThat(result.getDailyLimit()).isEqualTo(5);
        assertThat(result.getDaysSpanned()).isEqualTo(3);
        assertThat(result.getPerDay()).containsExactly(
                entry(TODAY, 5), entry(TODAY.plusDays(1), 5), entry(TODAY.plusDays(2), 2));

        for (ScheduledStep step : pending) {
            ScheduledStep stored = stepStore.get(step.getId());
            assertThat(stored.getStatus()).isEqualTo(StepStatus.PENDING);
            assertThat(stored.getScheduledAt()).isAfterOrEqualTo(NOW.plus(Duration.ofMinutes(5)));
            assertThat(stored.getScheduledAt()).isBefore(TODAY.plusDays(2).atTime(21, 0).toInstant(ZoneOffset.UTC));
        }
    }

    @Test
    void rescheduleWarmup_ShouldCountTodaysSendsAgainstFirstDay() {
        // Given - 3 sends already made today
        for (int i = 0; i < 3; i++) {
            stepStore.save(step(Channel.LINKEDIN_CONNECTION, StepStatus.SENT).toBuilder()
                    .campaignId(99L)
                    .executedAt(NOW.minus(Duration.ofHours(1)).plusSeconds(i))
                    .build());
        }
        savePending(12);

        // When
        WarmupRescheduleResultDto result = service(NOW).rescheduleWarmup(CAMPAIGN);

        // Then
        assertThat(result.getSentToday()).isEqualTo(3);
        assertThat(result.getPerDay()).containsExactly(
                entry(TODAY, 2), entry(TODAY.plusDays(1), 5), entry(TODAY.plusDays(2), 5));
    }

    @Test
    void rescheduleWarmup_ShouldStartTomorrowWhenTodaysWindowIsOver() {
        savePending(12);

        WarmupRescheduleResultDto result = service(Instant.parse("2024-03-13T20:58:00Z")).rescheduleWarmup(CAMPAIGN);

        assertThat(result.getPerDay()).containsExactly(
                entry(TODAY.plusDays(1), 5), entry(TODAY.plusDays(2), 5), entry(TODAY.plusDays(3), 2));
    }

    @Test
    void rescheduleWarmup_ShouldLeaveOtherChannelsAlone() {
        ScheduledStep email = stepStore.save(step(Channel.EMAIL, StepStatus.PENDING));
        savePending(2);

        WarmupRescheduleResultDto result = service(NOW).rescheduleWarmup(CAMPAIGN);

        assertThat(result.getRescheduledCount()).isEqualTo(2);
        assertThat(stepStore.get(email.getId()).getScheduledAt()).isEqualTo(email.getScheduledAt());
    }

    @Test
    void rescheduleWarmup_ShouldReportNothingForCampaignWithoutInvites() {
        WarmupRescheduleResultDto result = service(NOW).rescheduleWarmup(CAMPAIGN);

        assertThat(result.getRescheduledCount()).isZero();
        assertThat(result.getDaysSpanned()).isZero();
        assertThat(result.getPerDay()).isEmpty();
    }

    private WarmupRescheduleService service(Instant now) {
        SendWindowPlanner planner = new SendWindowPlanner(OutreachProperties.defaults(), new Random(11));
        WarmupPolicy policy = new WarmupPolicy();
        return new WarmupRescheduleService(stepStore, new WarmupRateLimiter(stepStore, policy, planner),
                policy, planner, Clock.fixed(now, ZoneOffset.UTC));
    }

    private List<ScheduledStep> savePending(int count) {
        List<ScheduledStep> saved = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            saved.add(stepStore.save(step(Channel.LINKEDIN_CONNECTION, StepStatus.PENDING)));
        }
        return saved;
    }

    private ScheduledStep step(Channel channel, StepStatus status) {
        return ScheduledStep.builder()
                .campaignId(CAMPAIGN)
                .contactId(nextContact++)
                .workspaceId(7L)
                .stepIndex(0)
                .channel(channel)
                .scheduledAt(NOW.minus(Duration.ofHours(3)))
                .status(status)
                .build();
    }
}
