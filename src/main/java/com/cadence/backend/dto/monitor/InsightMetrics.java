package com.cadence.backend.dto.monitor;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InsightMetrics {
    private int totalContacts;
    private int invitesSent;
    private int awaitingResponse;
    private int connected;
    private int scheduled;
    private int alreadyConnected;
    private int failed;
}
