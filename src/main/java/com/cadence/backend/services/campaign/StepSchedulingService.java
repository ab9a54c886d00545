package com.cadence.backend.services.campaign;

import com.cadence.backend.dto.campaign.request.ScheduleStepsRequest;
import com.cadence.backend.dto.campaign.request.StepTemplateRequest;
import com.cadence.backend.dto.campaign.response.ScheduleStepsResultDto;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Bulk creation of the step grid (contacts x sequence steps) for a campaign.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StepSchedulingService {

    private final StepStore stepStore;
    private final Clock clock;

    /**
     * Step i of every contact is due {@code sum(delayDays[0..i])} days from now. Rows that
     * already exist for (campaign, contact, stepIndex) are left untouched, so re-running
     * the same request only fills gaps.
     */
    public ScheduleStepsResultDto scheduleCampaignSteps(Long campaignId, ScheduleStepsRequest request) {
        List<StepTemplateRequest> templates = request.getSteps();
        Instant now = clock.instant();
        int inserted = 0;
        int requested = 0;

        for (Long contactId : request.getContactIds()) {
            long offsetDays = 0;
            for (int stepIndex = 0; stepIndex < templates.size(); stepIndex++) {
                StepTemplateRequest template = templates.get(stepIndex);
                offsetDays += Math.max(0, template.getDelayDays());
                requested++;

                ScheduledStep step = ScheduledStep.builder()
                        .campaignId(campaignId)
                        .contactId(contactId)
                        .workspaceId(request.getWorkspaceId())
                        .stepIndex(stepIndex)
                        .channel(template.getChannel())
                        .subject(template.getSubject())
                        .content(template.getContent())
                        .scheduledAt(now.plus(Duration.ofDays(offsetDays)))
                        .status(template.isRequiresApproval() ? StepStatus.REQUIRES_APPROVAL : StepStatus.PENDING)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();

                if (stepStore.insertIfAbsent(step)) {
                    inserted++;
                }
            }
        }

        log.info("Scheduled {} of {} steps for campaign {} ({} contacts, {} steps each)",
                inserted, requested, campaignId, request.getContactIds().size(), templates.size());

        return ScheduleStepsResultDto.builder()
                .campaignId(campaignId)
                .requested(requested)
                .inserted(inserted)
                .skippedDuplicates(requested - inserted)
                .build();
    }
}
