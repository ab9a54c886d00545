package com.cadence.backend.dto.campaign.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SchedulerPassDto {
    private Instant ranAt;
    private int due;
    private int claimed;
    private int lostClaims;
    private int approvalRequired;
    private int deferred;
    private int dispatched;
}
