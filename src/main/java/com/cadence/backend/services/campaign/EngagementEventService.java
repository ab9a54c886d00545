package com.cadence.backend.services.campaign;

import com.cadence.backend.dto.campaign.request.RecordEventRequest;
import com.cadence.backend.enums.EngagementEventType;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.models.campaign.StepEngagementEvent;
import com.cadence.backend.repositories.campaign.StepEngagementEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Append-only engagement log feeding step metrics and the engagement trend.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementEventService {

    private final StepEngagementEventRepository eventRepository;
    private final Clock clock;

    @Transactional
    public StepEngagementEvent recordSent(ScheduledStep step, Instant occurredAt) {
        return eventRepository.save(StepEngagementEvent.builder()
                .campaignId(step.getCampaignId())
                .contactId(step.getContactId())
                .stepIndex(step.getStepIndex())
                .channel(step.getChannel())
                .eventType(EngagementEventType.SENT)
                .occurredAt(occurredAt)
                .build());
    }

    @Transactional
    public StepEngagementEvent recordEvent(RecordEventRequest request) {
        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : clock.instant();
        StepEngagementEvent saved = eventRepository.save(StepEngagementEvent.builder()
                .campaignId(request.getCampaignId())
                .contactId(request.getContactId())
                .stepIndex(request.getStepIndex())
                .channel(request.getChannel())
                .eventType(request.getEventType())
                .occurredAt(occurredAt)
                .build());

        log.debug("Recorded {} for campaign {} contact {} step {}",
                request.getEventType(), request.getCampaignId(), request.getContactId(), request.getStepIndex());
        return saved;
    }
}
