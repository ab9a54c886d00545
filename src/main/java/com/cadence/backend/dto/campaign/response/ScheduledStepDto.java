package com.cadence.backend.dto.campaign.response;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ScheduledStepDto {
    private Long id;
    private Long campaignId;
    private Long contactId;
    private Long workspaceId;
    private Integer stepIndex;
    private Channel channel;
    private String subject;
    private String content;
    private StepStatus status;
    private Instant scheduledAt;
    private Instant executedAt;
    private ErrorCategory errorCategory;
    private String errorMessage;
    private String approvedBy;
    private Instant approvedAt;
    private String rejectedBy;
    private String rejectionReason;

    public static ScheduledStepDto from(ScheduledStep step) {
        return ScheduledStepDto.builder()
                .id(step.getId())
                .campaignId(step.getCampaignId())
                .contactId(step.getContactId())
                .workspaceId(step.getWorkspaceId())
                .stepIndex(step.getStepIndex())
                .channel(step.getChannel())
                .subject(step.getSubject())
                .content(step.getContent())
                .status(step.getStatus())
                .scheduledAt(step.getScheduledAt())
                .executedAt(step.getExecutedAt())
                .errorCategory(step.getErrorCategory())
                .errorMessage(step.getErrorMessage())
                .approvedBy(step.getApprovedBy())
                .approvedAt(step.getApprovedAt())
                .rejectedBy(step.getRejectedBy())
                .rejectionReason(step.getRejectionReason())
                .build();
    }
}
