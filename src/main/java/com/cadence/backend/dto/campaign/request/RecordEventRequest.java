package com.cadence.backend.dto.campaign.request;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.EngagementEventType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordEventRequest {
    @NotNull(message = "Campaign ID is required")
    private Long campaignId;

    @NotNull(message = "Contact ID is required")
    private Long contactId;

    @NotNull(message = "Step index is required")
    @Min(0)
    private Integer stepIndex;

    private Channel channel;

    @NotNull(message = "Event type is required")
    private EngagementEventType eventType;

    private Instant occurredAt; // defaults to now
}
