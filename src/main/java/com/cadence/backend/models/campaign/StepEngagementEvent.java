package com.cadence.backend.models.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.EngagementEventType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "step_engagement_events",
        indexes = {
                @Index(name = "idx_engagement_campaign_time", columnList = "campaign_id, occurred_at"),
                @Index(name = "idx_engagement_campaign_step", columnList = "campaign_id, step_index")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepEngagementEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @NotNull
    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    @NotNull
    @Column(name = "step_index", nullable = false)
    private Integer stepIndex;

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    private Channel channel;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private EngagementEventType eventType;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
