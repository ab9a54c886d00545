package com.cadence.backend.services.campaign;

import com.cadence.backend.models.campaign.ScheduledStep;

/**
 * Decides whether a step needs a human decision before its first admission.
 */
public interface ApprovalPolicy {

    boolean requiresApproval(ScheduledStep step);
}
