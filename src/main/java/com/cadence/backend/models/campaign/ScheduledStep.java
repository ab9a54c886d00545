package com.cadence.backend.models.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One planned outreach touch for one contact at one step index of a campaign.
 */
@Entity
@Table(name = "campaign_scheduled_steps",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_scheduled_step_campaign_contact_index",
                columnNames = {"campaign_id", "contact_id", "step_index"}),
        indexes = {
                @Index(name = "idx_scheduled_step_due", columnList = "status, scheduled_at"),
                @Index(name = "idx_scheduled_step_workspace_executed", columnList = "workspace_id, executed_at"),
                @Index(name = "idx_scheduled_step_contact_channel", columnList = "contact_id, channel, status")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @NotNull
    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    /**
     * Sending account. Warmup caps are tracked per workspace.
     */
    @NotNull
    @Column(name = "workspace_id", nullable = false)
    private Long workspaceId;

    @Min(0)
    @Column(name = "step_index", nullable = false)
    private Integer stepIndex;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private Channel channel;

    @Column(length = 500)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String content;

    @NotNull
    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category", length = 60)
    private ErrorCategory errorCategory;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "approved_by", length = 120)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "rejected_by", length = 120)
    private String rejectedBy;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Helper methods
    public boolean isDue(Instant now) {
        return scheduledAt != null && !scheduledAt.isAfter(now);
    }

    public boolean isStale(Instant now, Duration threshold) {
        return status == StepStatus.EXECUTING
                && updatedAt != null
                && updatedAt.isBefore(now.minus(threshold));
    }
}
