package com.cadence.backend.services.campaign;

import com.cadence.backend.enums.AutonomyLevel;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.models.campaign.CampaignSettings;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.CampaignSettingsRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignSettingsApprovalPolicyTest {

    @Mock
    private CampaignSettingsRepository settingsRepository;

    @InjectMocks
    private CampaignSettingsApprovalPolicy approvalPolicy;

    @Test
    void requiresApproval_ShouldTreatCampaignWithoutSettingsAsAutonomous() {
        when(settingsRepository.findById(1L)).thenReturn(Optional.empty());

        assertThat(approvalPolicy.requiresApproval(step(Channel.LINKEDIN_CONNECTION))).isFalse();
    }

    @Test
    void requiresApproval_ShouldAskForEveryStepUnderManualApproval() {
        when(settingsRepository.findById(1L)).thenReturn(Optional.of(settings(AutonomyLevel.MANUAL_APPROVAL, 80)));

        assertThat(approvalPolicy.requiresApproval(step(Channel.EMAIL))).isTrue();
    }

    @Test
    void requiresApproval_ShouldNeverAskWhenFullyAutonomous() {
        CampaignSettings settings = settings(AutonomyLevel.FULLY_AUTONOMOUS, 100);

        for (Channel channel : Channel.values()) {
            assertThat(approvalPolicy.requiresApproval(settings, channel)).as(channel.name()).isFalse();
        }
    }

    @Test
    void requiresApproval_ShouldReviewSensitiveChannelsWhenSemiAutonomous() {
        CampaignSettings settings = settings(AutonomyLevel.SEMI_AUTONOMOUS, 80);

        assertThat(approvalPolicy.requiresApproval(settings, Channel.LINKEDIN_CONNECTION)).isTrue();
        assertThat(approvalPolicy.requiresApproval(settings, Channel.LINKEDIN_MESSAGE)).isTrue();
        assertThat(approvalPolicy.requiresApproval(settings, Channel.PHONE)).isTrue();
        assertThat(approvalPolicy.requiresApproval(settings, Channel.VOICEMAIL)).isTrue();
        assertThat(approvalPolicy.requiresApproval(settings, Channel.EMAIL)).isFalse();
        assertThat(approvalPolicy.requiresApproval(settings, Channel.SMS)).isFalse();
    }

    @Test
    void requiresApproval_ShouldCompareConfidenceAgainstThreshold() {
        // Email confidence 90, SMS 85
        CampaignSettings strict = settings(AutonomyLevel.SEMI_AUTONOMOUS, 88);

        assertThat(approvalPolicy.requiresApproval(strict, Channel.EMAIL)).isFalse();
        assertThat(approvalPolicy.requiresApproval(strict, Channel.SMS)).isTrue();
    }

    @Test
    void requiresApproval_ShouldFallBackToDefaultThreshold() {
        CampaignSettings noThreshold = settings(AutonomyLevel.SEMI_AUTONOMOUS, null);

        assertThat(approvalPolicy.requiresApproval(noThreshold, Channel.SMS)).isFalse();
        assertThat(CampaignSettingsApprovalPolicy.DEFAULT_CONFIDENCE_THRESHOLD).isEqualTo(80);
    }

    private static CampaignSettings settings(AutonomyLevel level, Integer threshold) {
        return CampaignSettings.builder()
                .campaignId(1L)
                .name("Q2 founders")
                .autonomyLevel(level)
                .confidenceThreshold(threshold)
                .build();
    }

    private static ScheduledStep step(Channel channel) {
        return ScheduledStep.builder().id(10L).campaignId(1L).contactId(2L).workspaceId(7L)
                .stepIndex(0).channel(channel).build();
    }
}
