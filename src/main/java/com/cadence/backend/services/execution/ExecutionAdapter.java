package com.cadence.backend.services.execution;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.models.campaign.ScheduledStep;

import java.util.Set;

/**
 * Performs the actual channel send for a claimed step.
 *
 * Implementations are called from the outreach worker pool and may block;
 * the caller bounds each call with the configured execution timeout.
 * Delivery problems are reported as {@link ExecutionResult#failure}, not thrown.
 */
public interface ExecutionAdapter {

    Set<Channel> supportedChannels();

    ExecutionResult execute(ScheduledStep step);
}
