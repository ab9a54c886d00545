package com.cadence.backend.dto.campaign.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStepsRequest {
    @NotNull(message = "Workspace ID is required")
    private Long workspaceId;

    @NotEmpty(message = "At least one contact is required")
    private List<Long> contactIds;

    @NotEmpty(message = "At least one step is required")
    @Valid
    private List<StepTemplateRequest> steps;
}
