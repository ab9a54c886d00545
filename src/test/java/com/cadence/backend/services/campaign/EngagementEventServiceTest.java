package com.cadence.backend.services.campaign;

import com.cadence.backend.dto.campaign.request.RecordEventRequest;
import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.EngagementEventType;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.models.campaign.StepEngagementEvent;
import com.cadence.backend.repositories.campaign.StepEngagementEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngagementEventServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    @Mock
    private StepEngagementEventRepository eventRepository;

    private EngagementEventService eventService;

    @BeforeEach
    void setUp() {
        eventService = new EngagementEventService(eventRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        when(eventRepository.save(any(StepEngagementEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void recordSent_ShouldCopyStepCoordinates() {
        ScheduledStep step = ScheduledStep.builder()
                .id(9L).campaignId(1L).contactId(2L).workspaceId(7L).stepIndex(3).channel(Channel.SMS)
                .build();

        StepEngagementEvent event = eventService.recordSent(step, NOW.minusSeconds(5));

        assertThat(event.getEventType()).isEqualTo(EngagementEventType.SENT);
        assertThat(event.getCampaignId()).isEqualTo(1L);
        assertThat(event.getContactId()).isEqualTo(2L);
        assertThat(event.getStepIndex()).isEqualTo(3);
        assertThat(event.getChannel()).isEqualTo(Channel.SMS);
        assertThat(event.getOccurredAt()).isEqualTo(NOW.minusSeconds(5));
    }

    @Test
    void recordEvent_ShouldDefaultOccurredAtToNow() {
        RecordEventRequest request = RecordEventRequest.builder()
                .campaignId(1L).contactId(2L).stepIndex(0).eventType(EngagementEventType.OPENED)
                .build();

        eventService.recordEvent(request);

        ArgumentCaptor<StepEngagementEvent> captor = ArgumentCaptor.forClass(StepEngagementEvent.class);
        verify(eventRepository).save(captor.capture());
        assertThat(captor.getValue().getOccurredAt()).isEqualTo(NOW);
        assertThat(captor.getValue().getEventType()).isEqualTo(EngagementEventType.OPENED);
    }

    @Test
    void recordEvent_ShouldKeepReportedTimestamp() {
        Instant reported = Instant.parse("2024-03-12T18:30:00Z");
        RecordEventRequest request = RecordEventRequest.builder()
                .campaignId(1L).contactId(2L).stepIndex(1).eventType(EngagementEventType.REPLIED)
                .occurredAt(reported)
                .build();

        StepEngagementEvent event = eventService.recordEvent(request);

        assertThat(event.getOccurredAt()).isEqualTo(reported);
    }
}
