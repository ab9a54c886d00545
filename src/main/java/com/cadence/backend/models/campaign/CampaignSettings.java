package com.cadence.backend.models.campaign;

import com.cadence.backend.enums.AutonomyLevel;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Per-campaign settings consumed by the scheduler: display name and approval autonomy.
 */
@Entity
@Table(name = "campaign_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignSettings {

    @Id
    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "workspace_id")
    private Long workspaceId;

    @Column(nullable = false)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "autonomy_level", nullable = false, length = 40)
    @Builder.Default
    private AutonomyLevel autonomyLevel = AutonomyLevel.FULLY_AUTONOMOUS;

    @Min(0) @Max(100)
    @Column(name = "confidence_threshold")
    @Builder.Default
    private Integer confidenceThreshold = 80;
}
