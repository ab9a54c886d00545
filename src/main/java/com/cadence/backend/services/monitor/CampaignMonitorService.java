package com.cadence.backend.services.monitor;

import com.cadence.backend.config.OutreachProperties;
import com.cadence.backend.dto.monitor.CampaignHealthReport;
import com.cadence.backend.dto.monitor.CampaignProgress;
import com.cadence.backend.dto.monitor.CampaignRecommendation;
import com.cadence.backend.dto.monitor.FailureBreakdown;
import com.cadence.backend.dto.monitor.HealthInsights;
import com.cadence.backend.dto.monitor.InsightReport;
import com.cadence.backend.dto.monitor.StepAnalysis;
import com.cadence.backend.dto.monitor.StepHighlight;
import com.cadence.backend.dto.monitor.StepMetrics;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.EngagementEventType;
import com.cadence.backend.enums.EngagementTrend;
import com.cadence.backend.enums.OverallHealth;
import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.RecommendationType;
import com.cadence.backend.enums.StepPerformance;
import com.cadence.backend.models.campaign.CampaignSettings;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.CampaignSettingsRepository;
import com.cadence.backend.repositories.campaign.StepEngagementEventRepository;
import com.cadence.backend.repositories.campaign.StepStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Read-side aggregation of step outcomes and the engagement log into progress,
 * health scores and recommendations. Never writes.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class CampaignMonitorService {

    private static final Duration TREND_WINDOW = Duration.ofHours(24);
    private static final int HIGH_BOUNCE_RATE = 5;
    private static final int ZERO_ENGAGEMENT_MIN_SENT = 10;

    private final StepStore stepStore;
    private final StepEngagementEventRepository eventRepository;
    private final CampaignSettingsRepository settingsRepository;
    private final StepHealthAnalyzer stepHealthAnalyzer;
    private final InsightSummarizer insightSummarizer;
    private final Clock clock;
    private final int trendMinEvents;

    public CampaignMonitorService(StepStore stepStore,
                                  StepEngagementEventRepository eventRepository,
                                  CampaignSettingsRepository settingsRepository,
                                  StepHealthAnalyzer stepHealthAnalyzer,
                                  InsightSummarizer insightSummarizer,
                                  Clock clock,
                                  OutreachProperties properties) {
        this.stepStore = stepStore;
        this.eventRepository = eventRepository;
        this.settingsRepository = settingsRepository;
        this.stepHealthAnalyzer = stepHealthAnalyzer;
        this.insightSummarizer = insightSummarizer;
        this.clock = clock;
        this.trendMinEvents = properties.monitor().trendMinEvents();
    }

    // =========================
    // PROGRESS
    // =========================

    public CampaignProgress getProgress(Long campaignId) {
        List<ScheduledStep> steps = requireSteps(campaignId);
        return buildProgress(campaignId, steps, collectStepMetrics(campaignId, steps), clock.instant());
    }

    /**
     * Per step index counts from the engagement log. The channel of an index is the
     * channel of its first scheduled step.
     */
    public List<StepMetrics> collectStepMetrics(Long campaignId, List<ScheduledStep> steps) {
        Map<Integer, Channel> channels = new TreeMap<>();
        steps.stream()
                .sorted(Comparator.comparing(ScheduledStep::getStepIndex).thenComparing(ScheduledStep::getId,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(step -> channels.putIfAbsent(step.getStepIndex(), step.getChannel()));

        Map<Integer, Map<EngagementEventType, Long>> counts = new HashMap<>();
        for (Object[] row : eventRepository.countByStepAndType(campaignId)) {
            Integer stepIndex = (Integer) row[0];
            EngagementEventType type = (EngagementEventType) row[1];
            Long count = (Long) row[2];
            counts.computeIfAbsent(stepIndex, k -> new EnumMap<>(EngagementEventType.class)).put(type, count);
            if (!channels.containsKey(stepIndex)) {
                log.debug("Engagement events for campaign {} step {} without a scheduled step", campaignId, stepIndex);
            }
        }

        List<StepMetrics> metrics = new ArrayList<>();
        channels.forEach((stepIndex, channel) -> {
            Map<EngagementEventType, Long> c = counts.getOrDefault(stepIndex, Map.of());
            metrics.add(StepMetrics.builder()
                    .stepIndex(stepIndex)
                    .channel(channel)
                    .sent(c.getOrDefault(EngagementEventType.SENT, 0L))
                    .delivered(c.getOrDefault(EngagementEventType.DELIVERED, 0L))
                    .opened(c.getOrDefault(EngagementEventType.OPENED, 0L))
                    .clicked(c.getOrDefault(EngagementEventType.CLICKED, 0L))
                    .replied(c.getOrDefault(EngagementEventType.REPLIED, 0L))
                    .bounced(c.getOrDefault(EngagementEventType.BOUNCED, 0L))
                    .unsubscribed(c.getOrDefault(EngagementEventType.UNSUBSCRIBED, 0L))
                    .build());
        });
        return metrics;
    }

    CampaignProgress buildProgress(Long campaignId, List<ScheduledStep> steps, List<StepMetrics> metrics, Instant now) {
        int totalContacts = (int) steps.stream().map(ScheduledStep::getContactId).distinct().count();
        int totalSteps = metrics.size();
        long totalSent = metrics.stream().mapToLong(StepMetrics::getSent).sum();
        long expectedTotal = (long) totalContacts * totalSteps;

        // Re-sent steps after a reset can push the raw ratio past 100
        int progressPercent = expectedTotal > 0
                ? (int) Math.min(100, Math.round(100.0 * totalSent / expectedTotal))
                : 0;

        int currentStep = 1;
        for (StepMetrics step : metrics) {
            if (step.getSent() > 0) {
                currentStep = step.getStepNumber();
            }
        }

        int contactsCompleted = metrics.isEmpty()
                ? 0
                : (int) Math.min(totalContacts, metrics.get(metrics.size() - 1).getSent());
        int contactsOptedOut = (int) eventRepository.countDistinctContacts(campaignId, EngagementEventType.UNSUBSCRIBED);
        int contactsReplied = (int) eventRepository.countDistinctContacts(campaignId, EngagementEventType.REPLIED);

        Instant startedAt = steps.stream()
                .map(ScheduledStep::getCreatedAt)
                .filter(Objects::nonNull)
                .min(Instant::compareTo)
                .orElse(null);

        return CampaignProgress.builder()
                .campaignId(campaignId)
                .campaignName(campaignName(campaignId))
                .totalContacts(totalContacts)
                .contactsInProgress(Math.max(0, totalContacts - contactsCompleted - contactsOptedOut))
                .contactsCompleted(contactsCompleted)
                .contactsOptedOut(contactsOptedOut)
                .contactsReplied(contactsReplied)
                .currentStep(currentStep)
                .totalSteps(totalSteps)
                .progressPercent(progressPercent)
                .startedAt(startedAt)
                .estimatedCompletion(estimateCompletion(startedAt, progressPercent, now))
                .statusCounts(stepStore.countByStatus(campaignId))
                .failureBreakdown(stepStore.countFailuresByCategory(campaignId).stream()
                        .map(f -> FailureBreakdown.of(f.category(), f.count(), f.sampleError()))
                        .toList())
                .steps(metrics)
                .build();
    }

    /**
     * Linear extrapolation of elapsed time to 100%.
     */
    static Instant estimateCompletion(Instant startedAt, int progressPercent, Instant now) {
        if (startedAt == null || progressPercent <= 0 || now.isBefore(startedAt)) {
            return null;
        }
        long elapsedMillis = Duration.between(startedAt, now).toMillis();
        long estimatedTotal = Math.round(elapsedMillis / (progressPercent / 100.0));
        return now.plusMillis(estimatedTotal - elapsedMillis);
    }

    // =========================
    // HEALTH
    // =========================

    public CampaignHealthReport getHealthReport(Long campaignId) {
        Instant now = clock.instant();
        List<ScheduledStep> steps = requireSteps(campaignId);
        List<StepMetrics> metrics = collectStepMetrics(campaignId, steps);
        CampaignProgress progress = buildProgress(campaignId, steps, metrics, now);

        List<StepAnalysis> analyses = metrics.stream().map(stepHealthAnalyzer::analyze).toList();
        double averageScore = analyses.stream().mapToInt(StepAnalysis::getHealthScore).average().orElse(0);
        OverallHealth overallHealth = OverallHealth.fromAverage(averageScore);

        List<StepAnalysis> underperforming = analyses.stream()
                .filter(a -> a.getPerformance().isUnderperforming())
                .toList();
        List<CampaignRecommendation> recommendations = campaignRecommendations(metrics, underperforming);

        Channel bestChannel = bestChannel(metrics);
        int projectedCompletionRate = progress.getTotalContacts() > 0
                ? (int) Math.round(100.0 * (progress.getContactsCompleted() + progress.getContactsReplied() * 0.5)
                        / progress.getTotalContacts())
                : 0;

        HealthInsights insights = HealthInsights.builder()
                .topPerformingStep(topStep(metrics))
                .bottomPerformingStep(bottomStep(metrics))
                .bestChannel(bestChannel)
                .engagementTrend(engagementTrend(campaignId, now))
                .projectedCompletionRate(projectedCompletionRate)
                .build();

        log.debug("Campaign {} health {} (score {})", campaignId, overallHealth, Math.round(averageScore));

        return CampaignHealthReport.builder()
                .campaignId(campaignId)
                .overallHealth(overallHealth)
                .overallScore((int) Math.round(averageScore))
                .progress(progress)
                .stepAnalysis(analyses)
                .recommendations(recommendations)
                .insights(insights)
                .summary(summary(overallHealth, progress, bestChannel, underperforming.size(), recommendations))
                .generatedAt(now)
                .build();
    }

    List<CampaignRecommendation> campaignRecommendations(List<StepMetrics> metrics, List<StepAnalysis> underperforming) {
        List<CampaignRecommendation> recommendations = new ArrayList<>();

        if (!underperforming.isEmpty()) {
            boolean anyPoor = underperforming.stream().anyMatch(a -> a.getPerformance() == StepPerformance.POOR);
            List<Integer> affected = underperforming.stream().map(StepAnalysis::getStepNumber).toList();
            recommendations.add(CampaignRecommendation.builder()
                    .type(RecommendationType.ADJUST)
                    .priority(anyPoor ? RecommendationPriority.CRITICAL : RecommendationPriority.HIGH)
                    .title(underperforming.size() + " step(s) need attention")
                    .description("Steps " + joinNumbers(affected)
                            + " are underperforming and may need content or timing adjustments")
                    .affectedSteps(affected)
                    .build());
        }

        List<Integer> highBounce = metrics.stream()
                .filter(m -> m.getBounceRate() > HIGH_BOUNCE_RATE)
                .map(StepMetrics::getStepNumber)
                .toList();
        if (!highBounce.isEmpty()) {
            recommendations.add(CampaignRecommendation.builder()
                    .type(RecommendationType.PAUSE)
                    .priority(RecommendationPriority.CRITICAL)
                    .title("High bounce rates detected")
                    .description("Consider pausing campaign to verify contact data quality before continuing")
                    .affectedSteps(highBounce)
                    .build());
        }

        List<Integer> zeroEngagement = metrics.stream()
                .filter(m -> m.getSent() > ZERO_ENGAGEMENT_MIN_SENT && m.getOpened() == 0)
                .map(StepMetrics::getStepNumber)
                .toList();
        if (!zeroEngagement.isEmpty()) {
            recommendations.add(CampaignRecommendation.builder()
                    .type(RecommendationType.SKIP_STEP)
                    .priority(RecommendationPriority.MEDIUM)
                    .title("Zero engagement on some steps")
                    .description("Some steps have sent messages but received no engagement. Consider skipping or replacing them.")
                    .affectedSteps(zeroEngagement)
                    .build());
        }

        return recommendations;
    }

    /**
     * Channel with the highest replies/sent among channels that sent something; first seen wins ties.
     */
    static Channel bestChannel(List<StepMetrics> metrics) {
        Map<Channel, long[]> byChannel = new LinkedHashMap<>();
        for (StepMetrics step : metrics) {
            if (step.getChannel() == null) {
                continue;
            }
            long[] totals = byChannel.computeIfAbsent(step.getChannel(), c -> new long[2]);
            totals[0] += step.getReplied();
            totals[1] += step.getSent();
        }

        Channel best = null;
        double bestRatio = -1;
        for (Map.Entry<Channel, long[]> entry : byChannel.entrySet()) {
            long sent = entry.getValue()[1];
            if (sent == 0) {
                continue;
            }
            double ratio = (double) entry.getValue()[0] / sent;
            if (ratio > bestRatio) {
                best = entry.getKey();
                bestRatio = ratio;
            }
        }
        return best;
    }

    private static StepHighlight topStep(List<StepMetrics> metrics) {
        StepMetrics top = null;
        for (StepMetrics step : metrics) {
            if (step.getReplied() > 0 && (top == null || step.getReplyRate() > top.getReplyRate())) {
                top = step;
            }
        }
        return top != null ? replyHighlight(top) : null;
    }

    private static StepHighlight bottomStep(List<StepMetrics> metrics) {
        StepMetrics bottom = null;
        for (StepMetrics step : metrics) {
            if (step.getSent() > 0 && (bottom == null || step.getReplyRate() < bottom.getReplyRate())) {
                bottom = step;
            }
        }
        return bottom != null ? replyHighlight(bottom) : null;
    }

    private static StepHighlight replyHighlight(StepMetrics step) {
        return new StepHighlight(step.getStepNumber(), "reply rate", step.getReplyRate() + "%");
    }

    EngagementTrend engagementTrend(Long campaignId, Instant now) {
        long last = eventRepository.countBetween(campaignId, now.minus(TREND_WINDOW), now);
        long previous = eventRepository.countBetween(campaignId, now.minus(TREND_WINDOW.multipliedBy(2)),
                now.minus(TREND_WINDOW));
        return classifyTrend(last, previous, trendMinEvents);
    }

    /**
     * Last 24h volume against the 24h before it: at least 1.2x is improving, at most 0.8x declining.
     * Two empty windows, or fewer than {@code minEvents} events overall, read as stable.
     */
    static EngagementTrend classifyTrend(long last, long previous, int minEvents) {
        if (last + previous < minEvents || (last == 0 && previous == 0)) {
            return EngagementTrend.STABLE;
        }
        if (last >= previous * 1.2) {
            return EngagementTrend.IMPROVING;
        }
        if (last <= previous * 0.8) {
            return EngagementTrend.DECLINING;
        }
        return EngagementTrend.STABLE;
    }

    private String summary(OverallHealth health, CampaignProgress progress, Channel bestChannel,
                           int underperformingCount, List<CampaignRecommendation> recommendations) {
        String name = progress.getCampaignName();
        return switch (health) {
            case HEALTHY -> {
                String channelNote = bestChannel != null
                        ? " " + bestChannel.getDisplayName() + " is your best-performing channel."
                        : "";
                yield String.format("Campaign \"%s\" is performing well with %d%% complete.%s Keep monitoring for optimal results.",
                        name, progress.getProgressPercent(), channelNote);
            }
            case NEEDS_ATTENTION -> String.format(
                    "Campaign \"%s\" needs some adjustments. %d step(s) are underperforming. Review the content and timing of %s to improve engagement.",
                    name, underperformingCount, underperformingCount > 1 ? "these steps" : "this step");
            case AT_RISK -> String.format(
                    "Campaign \"%s\" is at risk with declining metrics. Consider pausing to make strategic adjustments before continuing. Focus on %s.",
                    name, recommendations.isEmpty() ? "improving content quality" : recommendations.get(0).getTitle());
            case CRITICAL -> String.format(
                    "Campaign \"%s\" requires immediate attention. Critical issues detected that could impact deliverability and results. Pause the campaign and address these issues before continuing.",
                    name);
        };
    }

    // =========================
    // INSIGHTS
    // =========================

    public InsightReport getInsights(Long campaignId) {
        return insightSummarizer.summarize(campaignId, stepStore.findByCampaign(campaignId), clock.instant());
    }

    private List<ScheduledStep> requireSteps(Long campaignId) {
        List<ScheduledStep> steps = stepStore.findByCampaign(campaignId);
        if (steps.isEmpty()) {
            throw new EntityNotFoundException("No scheduled steps for campaign " + campaignId);
        }
        return steps;
    }

    private String campaignName(Long campaignId) {
        return settingsRepository.findById(campaignId)
                .map(CampaignSettings::getName)
                .orElse("Campaign " + campaignId);
    }

    private static String joinNumbers(List<Integer> numbers) {
        return String.join(", ", numbers.stream().map(String::valueOf).toList());
    }
}
