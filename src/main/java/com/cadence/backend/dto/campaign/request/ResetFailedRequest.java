package com.cadence.backend.dto.campaign.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetFailedRequest {
    private String errorCategory; // taxonomy code, e.g. "session_expired"; optional

    private List<Long> contactIds; // optional subset
}
