package com.cadence.backend.services.monitor;

import com.cadence.backend.dto.monitor.Insight;
import com.cadence.backend.dto.monitor.InsightMetrics;
import com.cadence.backend.dto.monitor.InsightReport;
import com.cadence.backend.enums.InsightType;
import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Narrative insights for a campaign, built from the status of each contact's steps.
 */
@Component
public class InsightSummarizer {

    static final Duration PEAK_RESPONSE_WINDOW = Duration.ofHours(48);
    static final int ABOVE_AVERAGE_ACCEPTANCE = 30;

    public InsightReport summarize(Long campaignId, List<ScheduledStep> steps, Instant now) {
        Map<Long, List<ScheduledStep>> byContact = steps.stream()
                .collect(Collectors.groupingBy(ScheduledStep::getContactId, LinkedHashMap::new, Collectors.toList()));

        int sent = 0, completed = 0, pending = 0, skipped = 0, failed = 0, recentInvites = 0;
        for (List<ScheduledStep> contactSteps : byContact.values()) {
            switch (contactStatus(contactSteps)) {
                case SENT -> sent++;
                case COMPLETED -> completed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                default -> pending++;
            }
            Instant lastSentAt = lastSuccessAt(contactSteps);
            if (lastSentAt != null && !lastSentAt.isAfter(now)
                    && Duration.between(lastSentAt, now).compareTo(PEAK_RESPONSE_WINDOW) < 0) {
                recentInvites++;
            }
        }

        InsightMetrics metrics = InsightMetrics.builder()
                .totalContacts(byContact.size())
                .invitesSent(sent)
                .awaitingResponse(sent)
                .connected(completed)
                .scheduled(pending)
                .alreadyConnected(skipped)
                .failed(failed)
                .build();

        int acceptanceRate = metrics.getInvitesSent() > 0
                ? (int) Math.round(100.0 * metrics.getConnected() / metrics.getInvitesSent())
                : 0;

        return InsightReport.builder()
                .campaignId(campaignId)
                .summary(summary(metrics, acceptanceRate))
                .insights(insights(metrics, acceptanceRate, recentInvites))
                .metrics(metrics)
                .build();
    }

    /**
     * Roll a contact's steps up to one status: failed if any step failed; completed when every
     * step succeeded and at least one completed; sent if any step was sent; skipped when
     * everything not yet successful was skipped; pending otherwise.
     */
    static StepStatus contactStatus(List<ScheduledStep> steps) {
        if (steps.stream().anyMatch(s -> s.getStatus() == StepStatus.FAILED)) {
            return StepStatus.FAILED;
        }
        boolean allSuccessful = steps.stream().allMatch(s -> s.getStatus().isSuccessful());
        if (allSuccessful && steps.stream().anyMatch(s -> s.getStatus() == StepStatus.COMPLETED)) {
            return StepStatus.COMPLETED;
        }
        if (steps.stream().anyMatch(s -> s.getStatus() == StepStatus.SENT)) {
            return StepStatus.SENT;
        }
        List<ScheduledStep> remaining = steps.stream()
                .filter(s -> !s.getStatus().isSuccessful())
                .toList();
        if (!remaining.isEmpty() && remaining.stream().allMatch(s -> s.getStatus() == StepStatus.SKIPPED)) {
            return StepStatus.SKIPPED;
        }
        return StepStatus.PENDING;
    }

    private static Instant lastSuccessAt(List<ScheduledStep> steps) {
        return steps.stream()
                .filter(s -> s.getStatus().isSuccessful())
                .map(ScheduledStep::getExecutedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);
    }

    private List<Insight> insights(InsightMetrics metrics, int acceptanceRate, int recentInvites) {
        List<Insight> insights = new ArrayList<>();

        if (metrics.getInvitesSent() > 0) {
            String progress = metrics.getConnected() > 0
                    ? String.format("%d accepted so far (%d%% rate).", metrics.getConnected(), acceptanceRate)
                    : "Awaiting responses.";
            String description = acceptanceRate >= ABOVE_AVERAGE_ACCEPTANCE ? progress + " Above average!" : progress;
            insights.add(new Insight(InsightType.ACHIEVEMENT,
                    plural(metrics.getInvitesSent(), "Invite") + " Sent",
                    description, RecommendationPriority.MEDIUM));
        }

        if (metrics.getAwaitingResponse() > 3) {
            insights.add(new Insight(InsightType.OPPORTUNITY,
                    metrics.getAwaitingResponse() + " Pending Connections",
                    "These contacts have received your invite. Follow-up messages after acceptance can boost engagement by 40%.",
                    RecommendationPriority.MEDIUM));
        }

        if (metrics.getFailed() > 0) {
            insights.add(new Insight(InsightType.WARNING,
                    plural(metrics.getFailed(), "Failed Invite"),
                    "Some invites failed to send. Reset them to retry, or check the failure breakdown for the cause.",
                    RecommendationPriority.HIGH));
        }

        if (metrics.getScheduled() > 0) {
            insights.add(new Insight(InsightType.RECOMMENDATION,
                    metrics.getScheduled() + " Contacts Queued",
                    String.format("Invites are paced to stay within LinkedIn limits. %d more will be sent according to the warmup schedule.",
                            metrics.getScheduled()),
                    RecommendationPriority.LOW));
        }

        if (metrics.getAlreadyConnected() > 0) {
            insights.add(new Insight(InsightType.RECOMMENDATION,
                    metrics.getAlreadyConnected() + " Already Connected",
                    "These contacts were already 1st-degree connections. Consider sending them a personalized message instead.",
                    RecommendationPriority.MEDIUM));
        }

        if (recentInvites > 0) {
            insights.add(new Insight(InsightType.RECOMMENDATION,
                    "Peak Response Window",
                    String.format("%d invites sent in the last 48 hours. Most acceptances happen within 24-72 hours.",
                            recentInvites),
                    RecommendationPriority.LOW));
        }

        return insights;
    }

    private String summary(InsightMetrics metrics, int acceptanceRate) {
        if (metrics.getTotalContacts() == 0) {
            return "No contacts in this campaign yet. Add contacts to get started.";
        }
        if (metrics.getInvitesSent() == 0 && metrics.getScheduled() > 0) {
            return String.format("Campaign is warming up. %d contacts are scheduled to receive invites.",
                    metrics.getScheduled());
        }
        if (metrics.getAwaitingResponse() > metrics.getConnected()) {
            return String.format("Active outreach in progress. %d connections pending response, %d already accepted.",
                    metrics.getAwaitingResponse(), metrics.getConnected());
        }
        if (metrics.getConnected() > 0) {
            return String.format("Campaign performing well. %d%% acceptance rate with %d new connections.",
                    acceptanceRate, metrics.getConnected());
        }
        return String.format("Campaign initialized with %d contacts.", metrics.getTotalContacts());
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count > 1 ? "s" : "");
    }
}
