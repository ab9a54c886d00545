package com.cadence.backend.dto.campaign.request;

import com.cadence.backend.enums.Channel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepTemplateRequest {
    @NotNull(message = "Channel is required")
    private Channel channel;

    private String subject;

    private String content;

    @Min(value = 0, message = "Delay must be zero or positive")
    @Builder.Default
    private int delayDays = 0;

    @Builder.Default
    private boolean requiresApproval = false;
}
