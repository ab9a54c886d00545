package com.cadence.backend.dto.campaign.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RejectStepRequest {
    @NotBlank(message = "Approver is required")
    private String approverId;

    private String reason;
}
