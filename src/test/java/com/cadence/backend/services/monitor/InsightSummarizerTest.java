package com.cadence.backend.services.monitor;

import com.cadence.backend.dto.monitor.Insight;
import com.cadence.backend.dto.monitor.InsightReport;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.InsightType;
import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InsightSummarizerTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    private final InsightSummarizer summarizer = new InsightSummarizer();
    private final List<ScheduledStep> steps = new ArrayList<>();
    private long nextContact = 1;

    @Test
    void summarize_ShouldDescribeActiveOutreach() {
        // Given
        contact(StepStatus.SENT, NOW.minus(Duration.ofHours(1)));
        contact(StepStatus.SENT, NOW.minus(Duration.ofHours(10)));
        contact(StepStatus.SENT, NOW.minus(Duration.ofDays(3)));
        contact(StepStatus.SENT, NOW.minus(Duration.ofHours(72)));
        contact(StepStatus.SENT, NOW.minus(Duration.ofHours(49)));
        contact(StepStatus.COMPLETED, NOW.minus(Duration.ofDays(5)));
        contact(StepStatus.FAILED, NOW.minus(Duration.ofDays(1)));
        contact(StepStatus.PENDING, null);
        contact(StepStatus.SKIPPED, null);

        // When
        InsightReport report = summarizer.summarize(3L, steps, NOW);

        // Then
        assertThat(report.getMetrics().getTotalContacts()).isEqualTo(9);
        assertThat(report.getMetrics().getInvitesSent()).isEqualTo(5);
        assertThat(report.getMetrics().getConnected()).isEqualTo(1);
        assertThat(report.getMetrics().getScheduled()).isEqualTo(1);
        assertThat(report.getMetrics().getAlreadyConnected()).isEqualTo(1);
        assertThat(report.getMetrics().getFailed()).isEqualTo(1);
        assertThat(report.getSummary())
                .isEqualTo("Active outreach in progress. 5 connections pending response, 1 already accepted.");

        assertThat(report.getInsights())
                .extracting(Insight::getType, Insight::getTitle)
                .containsExactly(
                        tuple(InsightType.ACHIEVEMENT, "5 Invites Sent"),
                        tuple(InsightType.OPPORTUNITY, "5 Pending Connections"),
                        tuple(InsightType.WARNING, "1 Failed Invite"),
                        tuple(InsightType.RECOMMENDATION, "1 Contacts Queued"),
                        tuple(InsightType.RECOMMENDATION, "1 Already Connected"),
                        tuple(InsightType.RECOMMENDATION, "Peak Response Window"));
        assertThat(report.getInsights().get(0).getDescription()).isEqualTo("1 accepted so far (20% rate).");
        assertThat(report.getInsights().get(2).getPriority()).isEqualTo(RecommendationPriority.HIGH);
        assertThat(report.getInsights().get(5).getDescription())
                .startsWith("2 invites sent in the last 48 hours.");
    }

    @Test
    void summarize_ShouldHandleCampaignWithoutContacts() {
        InsightReport report = summarizer.summarize(3L, List.of(), NOW);

        assertThat(report.getSummary()).isEqualTo("No contacts in this campaign yet. Add contacts to get started.");
        assertThat(report.getInsights()).isEmpty();
        assertThat(report.getMetrics().getTotalContacts()).isZero();
    }

    @Test
    void summarize_ShouldReportWarmingUpBeforeFirstInvite() {
        contact(StepStatus.PENDING, null);
        contact(StepStatus.PENDING, null);
        contact(StepStatus.REQUIRES_APPROVAL, null);

        InsightReport report = summarizer.summarize(3L, steps, NOW);

        assertThat(report.getSummary())
                .isEqualTo("Campaign is warming up. 3 contacts are scheduled to receive invites.");
        assertThat(report.getInsights()).singleElement()
                .extracting(Insight::getDescription)
                .isEqualTo("Invites are paced to stay within LinkedIn limits. 3 more will be sent according to the warmup schedule.");
    }

    @Test
    void summarize_ShouldCallOutStrongAcceptance() {
        for (int i = 0; i < 3; i++) {
            contact(StepStatus.SENT, NOW.minus(Duration.ofDays(4)));
            contact(StepStatus.COMPLETED, NOW.minus(Duration.ofDays(4)));
        }

        InsightReport report = summarizer.summarize(3L, steps, NOW);

        assertThat(report.getSummary())
                .isEqualTo("Campaign performing well. 100% acceptance rate with 3 new connections.");
        assertThat(report.getInsights().get(0).getDescription())
                .isEqualTo("3 accepted so far (100% rate). Above average!");
    }

    @Test
    void summarize_ShouldFallBackToInitializedSummary() {
        contact(StepStatus.SKIPPED, null);
        contact(StepStatus.SKIPPED, null);

        InsightReport report = summarizer.summarize(3L, steps, NOW);

        assertThat(report.getSummary()).isEqualTo("Campaign initialized with 2 contacts.");
    }

    @Test
    void contactStatus_ShouldRollUpStepsPerContact() {
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.SENT, StepStatus.FAILED))).isEqualTo(StepStatus.FAILED);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.COMPLETED, StepStatus.SENT))).isEqualTo(StepStatus.COMPLETED);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.SENT, StepStatus.PENDING))).isEqualTo(StepStatus.SENT);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.SENT, StepStatus.SKIPPED))).isEqualTo(StepStatus.SENT);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.SKIPPED, StepStatus.SKIPPED))).isEqualTo(StepStatus.SKIPPED);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.PENDING, StepStatus.SKIPPED))).isEqualTo(StepStatus.PENDING);
        assertThat(InsightSummarizer.contactStatus(of(StepStatus.EXECUTING))).isEqualTo(StepStatus.PENDING);
    }

    private void contact(StepStatus status, Instant executedAt) {
        steps.add(ScheduledStep.builder()
                .id((long) steps.size() + 1)
                .campaignId(3L)
                .contactId(nextContact++)
                .workspaceId(7L)
                .stepIndex(0)
                .channel(Channel.LINKEDIN_CONNECTION)
                .scheduledAt(NOW.minus(Duration.ofDays(7)))
                .status(status)
                .executedAt(executedAt)
                .build());
    }

    private static List<ScheduledStep> of(StepStatus... statuses) {
        return Arrays.stream(statuses)
                .map(status -> ScheduledStep.builder().contactId(1L).status(status).build())
                .toList();
    }
}
