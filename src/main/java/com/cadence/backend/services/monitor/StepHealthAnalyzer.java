package com.cadence.backend.services.monitor;

import com.cadence.backend.dto.monitor.StepAnalysis;
import com.cadence.backend.dto.monitor.StepMetrics;
import com.cadence.backend.dto.monitor.StepRecommendation;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ChannelBenchmark;
import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.RecommendationType;
import com.cadence.backend.enums.StepPerformance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores one step's engagement against its channel benchmark.
 *
 * The score starts at 100 and loses points per rule (weak opens, weak replies, bounces,
 * unsubscribes, weak email clicks), floored at 0. A step that has not sent anything yet
 * gets a neutral 50.
 */
@Component
public class StepHealthAnalyzer {

    static final int NOT_STARTED_SCORE = 50;

    public StepAnalysis analyze(StepMetrics step) {
        if (step.getSent() == 0) {
            return notStarted(step);
        }

        ChannelBenchmark benchmark = ChannelBenchmark.forChannel(step.getChannel());
        List<String> issues = new ArrayList<>();
        List<StepRecommendation> recommendations = new ArrayList<>();
        int healthScore = 100;

        int openRate = step.getOpenRate();
        if (openRate < benchmark.getOpenRate() * 0.5) {
            healthScore -= 20;
            issues.add(String.format("Open rate %d%% is below average (benchmark: %d%%)",
                    openRate, benchmark.getOpenRate()));
            recommendations.add(StepRecommendation.builder()
                    .type(RecommendationType.CONTENT)
                    .priority(RecommendationPriority.HIGH)
                    .suggestion("Improve subject line or message preview")
                    .rationale(String.format("Current open rate is %d%% of benchmark",
                            Math.round(100.0 * openRate / benchmark.getOpenRate())))
                    .estimatedImpact(String.format("+%d%% potential improvement", benchmark.getOpenRate() - openRate))
                    .build());
        } else if (openRate < benchmark.getOpenRate() * 0.8) {
            healthScore -= 10;
            issues.add(String.format("Open rate %d%% is slightly below benchmark", openRate));
        }

        int replyRate = step.getReplyRate();
        if (replyRate < benchmark.getReplyRate() * 0.5) {
            healthScore -= 15;
            issues.add(String.format("Reply rate %d%% is below expectations", replyRate));
            recommendations.add(StepRecommendation.builder()
                    .type(RecommendationType.CONTENT)
                    .priority(RecommendationPriority.HIGH)
                    .suggestion("Revise call-to-action and message content")
                    .rationale("Low reply rates indicate the message may not be compelling enough")
                    .estimatedImpact(String.format("+%d%% potential reply rate", benchmark.getReplyRate() - replyRate))
                    .build());
        }

        int bounceRate = step.getBounceRate();
        if (bounceRate > benchmark.getBounceRate() * 2) {
            healthScore -= 25;
            issues.add(String.format("Bounce rate %d%% is critically high", bounceRate));
            recommendations.add(StepRecommendation.builder()
                    .type(RecommendationType.TARGETING)
                    .priority(RecommendationPriority.CRITICAL)
                    .suggestion("Verify contact data quality")
                    .rationale("High bounce rates can damage sender reputation")
                    .estimatedImpact("Prevent deliverability issues")
                    .build());
        }

        if (step.getUnsubscribed() > step.getSent() * 0.05) {
            healthScore -= 20;
            issues.add(String.format("%d unsubscribes (%d%%)", step.getUnsubscribed(),
                    Math.round(100.0 * step.getUnsubscribed() / step.getSent())));
            recommendations.add(StepRecommendation.builder()
                    .type(RecommendationType.CONTENT)
                    .priority(RecommendationPriority.HIGH)
                    .suggestion("Review message tone and frequency")
                    .rationale("High unsubscribe rate indicates content may be too aggressive")
                    .estimatedImpact("Reduce list attrition")
                    .build());
        }

        if (step.getChannel() == Channel.EMAIL && step.getClickRate() < benchmark.getClickRate() * 0.5) {
            healthScore -= 10;
            issues.add("Click-through rate is below benchmark");
            recommendations.add(StepRecommendation.builder()
                    .type(RecommendationType.CONTENT)
                    .priority(RecommendationPriority.MEDIUM)
                    .suggestion("Make CTA links more prominent")
                    .rationale("People are opening but not clicking")
                    .estimatedImpact("+2-5% click rate")
                    .build());
        }

        int score = Math.max(0, healthScore);
        return StepAnalysis.builder()
                .stepIndex(step.getStepIndex())
                .stepNumber(step.getStepNumber())
                .channel(step.getChannel())
                .performance(StepPerformance.fromScore(score))
                .healthScore(score)
                .issues(issues)
                .recommendations(recommendations)
                .build();
    }

    private StepAnalysis notStarted(StepMetrics step) {
        return StepAnalysis.builder()
                .stepIndex(step.getStepIndex())
                .stepNumber(step.getStepNumber())
                .channel(step.getChannel())
                .performance(StepPerformance.AVERAGE)
                .healthScore(NOT_STARTED_SCORE)
                .issues(List.of("No messages sent yet"))
                .recommendations(List.of(StepRecommendation.builder()
                        .type(RecommendationType.TIMING)
                        .priority(RecommendationPriority.LOW)
                        .suggestion("Step pending execution")
                        .rationale("This step has not started yet")
                        .estimatedImpact("N/A")
                        .build()))
                .build();
    }
}
