package com.cadence.backend.services.monitor;

import com.cadence.backend.dto.monitor.StepAnalysis;
import com.cadence.backend.dto.monitor.StepMetrics;
import com.cadence.backend.dto.monitor.StepRecommendation;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.RecommendationPriority;
import com.cadence.backend.enums.RecommendationType;
import com.cadence.backend.enums.StepPerformance;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StepHealthAnalyzerTest {

    private final StepHealthAnalyzer analyzer = new StepHealthAnalyzer();

    @Test
    void analyze_ShouldScoreHealthyEmailStepAsExcellent() {
        // Given - 28% open, 5% click, 3% reply, 2% bounce
        StepMetrics metrics = email(150, 42, 8, 5, 3, 0);

        // When
        StepAnalysis analysis = analyzer.analyze(metrics);

        // Then
        assertThat(analysis.getHealthScore()).isEqualTo(100);
        assertThat(analysis.getPerformance()).isEqualTo(StepPerformance.EXCELLENT);
        assertThat(analysis.getIssues()).isEmpty();
        assertThat(analysis.getRecommendations()).isEmpty();
        assertThat(analysis.getStepNumber()).isEqualTo(1);
    }

    @Test
    void analyze_ShouldGiveNeutralScoreToStepNotStarted() {
        StepAnalysis analysis = analyzer.analyze(StepMetrics.builder().stepIndex(3).channel(Channel.SMS).build());

        assertThat(analysis.getHealthScore()).isEqualTo(50);
        assertThat(analysis.getPerformance()).isEqualTo(StepPerformance.AVERAGE);
        assertThat(analysis.getIssues()).containsExactly("No messages sent yet");
        assertThat(analysis.getRecommendations()).singleElement()
                .satisfies(r -> {
                    assertThat(r.getType()).isEqualTo(RecommendationType.TIMING);
                    assertThat(r.getPriority()).isEqualTo(RecommendationPriority.LOW);
                    assertThat(r.getSuggestion()).isEqualTo("Step pending execution");
                });
        assertThat(analysis.getStepNumber()).isEqualTo(4);
    }

    @Test
    void analyze_ShouldPenalizeWeakOpensRepliesAndClicks() {
        // Given - 10% open against a 25% benchmark, no replies, no clicks
        StepMetrics metrics = email(100, 10, 0, 0, 0, 0);

        // When
        StepAnalysis analysis = analyzer.analyze(metrics);

        // Then
        assertThat(analysis.getHealthScore()).isEqualTo(55);
        assertThat(analysis.getPerformance()).isEqualTo(StepPerformance.BELOW_AVERAGE);
        assertThat(analysis.getIssues()).containsExactly(
                "Open rate 10% is below average (benchmark: 25%)",
                "Reply rate 0% is below expectations",
                "Click-through rate is below benchmark");

        StepRecommendation openFix = analysis.getRecommendations().get(0);
        assertThat(openFix.getSuggestion()).isEqualTo("Improve subject line or message preview");
        assertThat(openFix.getRationale()).isEqualTo("Current open rate is 40% of benchmark");
        assertThat(openFix.getEstimatedImpact()).isEqualTo("+15% potential improvement");
        assertThat(analysis.getRecommendations()).extracting(StepRecommendation::getPriority)
                .containsExactly(RecommendationPriority.HIGH, RecommendationPriority.HIGH, RecommendationPriority.MEDIUM);
    }

    @Test
    void analyze_ShouldFlagSlightlyLowOpenRateWithoutRecommendation() {
        // 30% on LinkedIn: under 80% of the 45% benchmark, above half of it
        StepMetrics metrics = StepMetrics.builder()
                .stepIndex(1).channel(Channel.LINKEDIN_MESSAGE)
                .sent(100).opened(30).replied(8)
                .build();

        StepAnalysis analysis = analyzer.analyze(metrics);

        assertThat(analysis.getHealthScore()).isEqualTo(90);
        assertThat(analysis.getIssues()).containsExactly("Open rate 30% is slightly below benchmark");
        assertThat(analysis.getRecommendations()).isEmpty();
    }

    @Test
    void analyze_ShouldRaiseCriticalRecommendationForBounces() {
        StepMetrics metrics = email(100, 30, 5, 3, 5, 0);

        StepAnalysis analysis = analyzer.analyze(metrics);

        assertThat(analysis.getHealthScore()).isEqualTo(75);
        assertThat(analysis.getPerformance()).isEqualTo(StepPerformance.GOOD);
        assertThat(analysis.getIssues()).containsExactly("Bounce rate 5% is critically high");
        assertThat(analysis.getRecommendations()).singleElement()
                .satisfies(r -> {
                    assertThat(r.getType()).isEqualTo(RecommendationType.TARGETING);
                    assertThat(r.getPriority()).isEqualTo(RecommendationPriority.CRITICAL);
                });
    }

    @Test
    void analyze_ShouldPenalizeUnsubscribesOverFivePercent() {
        StepAnalysis atLimit = analyzer.analyze(email(100, 30, 5, 3, 0, 5));
        StepAnalysis overLimit = analyzer.analyze(email(100, 30, 5, 3, 0, 6));

        assertThat(atLimit.getHealthScore()).isEqualTo(100);
        assertThat(overLimit.getHealthScore()).isEqualTo(80);
        assertThat(overLimit.getIssues()).containsExactly("6 unsubscribes (6%)");
    }

    @Test
    void analyze_ShouldStackEveryPenalty() {
        // Every rule fires: 20 + 15 + 25 + 20 + 10
        StepAnalysis analysis = analyzer.analyze(email(100, 0, 0, 0, 20, 10));

        assertThat(analysis.getHealthScore()).isEqualTo(10);
        assertThat(analysis.getPerformance()).isEqualTo(StepPerformance.POOR);
    }

    @Test
    void analyze_ShouldOnlyCheckClicksForEmail() {
        // Phone has no open or click benchmark
        StepMetrics call = StepMetrics.builder().stepIndex(4).channel(Channel.PHONE).sent(10).replied(3).build();

        assertThat(analyzer.analyze(call).getHealthScore()).isEqualTo(100);
    }

    private static StepMetrics email(long sent, long opened, long clicked, long replied, long bounced, long unsubscribed) {
        return StepMetrics.builder()
                .stepIndex(0)
                .channel(Channel.EMAIL)
                .sent(sent)
                .delivered(sent - bounced)
                .opened(opened)
                .clicked(clicked)
                .replied(replied)
                .bounced(bounced)
                .unsubscribed(unsubscribed)
                .build();
    }
}
