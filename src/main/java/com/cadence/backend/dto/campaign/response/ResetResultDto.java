package com.cadence.backend.dto.campaign.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ResetResultDto {
    private int resetCount;
    private List<Long> stepIds;
    private Instant firstScheduledAt;
    private Instant lastScheduledAt;
    private String message;

    public static ResetResultDto empty(String message) {
        return ResetResultDto.builder()
                .resetCount(0)
                .stepIds(List.of())
                .message(message)
                .build();
    }
}
