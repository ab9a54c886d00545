package com.cadence.backend.services.campaign;

import com.cadence.backend.enums.AutonomyLevel;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.models.campaign.CampaignSettings;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.CampaignSettingsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Approval rules keyed on the campaign's autonomy level. Campaigns without settings run fully autonomous.
 */
@Component
@RequiredArgsConstructor
public class CampaignSettingsApprovalPolicy implements ApprovalPolicy {

    static final int DEFAULT_CONFIDENCE_THRESHOLD = 80;

    // Always reviewed under semi-autonomous campaigns, whatever the confidence
    private static final Set<Channel> SENSITIVE_CHANNELS =
            EnumSet.of(Channel.LINKEDIN_CONNECTION, Channel.LINKEDIN_MESSAGE, Channel.PHONE, Channel.VOICEMAIL);

    private final CampaignSettingsRepository settingsRepository;

    @Override
    public boolean requiresApproval(ScheduledStep step) {
        return settingsRepository.findById(step.getCampaignId())
                .map(settings -> requiresApproval(settings, step.getChannel()))
                .orElse(false);
    }

    boolean requiresApproval(CampaignSettings settings, Channel channel) {
        AutonomyLevel level = settings.getAutonomyLevel() != null
                ? settings.getAutonomyLevel()
                : AutonomyLevel.FULLY_AUTONOMOUS;

        return switch (level) {
            case MANUAL_APPROVAL -> true;
            case SEMI_AUTONOMOUS -> {
                int threshold = settings.getConfidenceThreshold() != null
                        ? settings.getConfidenceThreshold()
                        : DEFAULT_CONFIDENCE_THRESHOLD;
                yield channel.getDefaultConfidence() < threshold || SENSITIVE_CHANNELS.contains(channel);
            }
            case FULLY_AUTONOMOUS -> false;
        };
    }
}
