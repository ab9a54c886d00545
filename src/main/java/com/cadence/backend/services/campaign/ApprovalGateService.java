package com.cadence.backend.services.campaign;

import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.exceptions.InvalidStateTransitionException;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Human decisions on steps parked in REQUIRES_APPROVAL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalGateService {

    private final StepStore stepStore;
    private final Clock clock;

    public List<ScheduledStep> listAwaitingApproval(Long workspaceId) {
        return stepStore.findAwaitingApproval(workspaceId);
    }

    /**
     * REQUIRES_APPROVAL to APPROVED. The step goes out on the next pass once it is due,
     * still subject to the warmup limiter.
     */
    public ScheduledStep approve(Long stepId, String approverId) {
        if (!stepStore.approve(stepId, approverId, clock.instant())) {
            throw rejectedTransition(stepId);
        }
        log.info("Step {} approved by {}", stepId, approverId);
        return getStep(stepId);
    }

    /**
     * REQUIRES_APPROVAL to SKIPPED, terminal. The reason is kept for audit.
     */
    public ScheduledStep reject(Long stepId, String approverId, String reason) {
        if (!stepStore.reject(stepId, approverId, reason, clock.instant())) {
            throw rejectedTransition(stepId);
        }
        log.info("Step {} rejected by {}: {}", stepId, approverId, reason);
        return getStep(stepId);
    }

    private RuntimeException rejectedTransition(Long stepId) {
        ScheduledStep step = getStep(stepId);
        return new InvalidStateTransitionException(stepId, step.getStatus(), StepStatus.REQUIRES_APPROVAL);
    }

    private ScheduledStep getStep(Long stepId) {
        return stepStore.findById(stepId)
                .orElseThrow(() -> new EntityNotFoundException("Scheduled step not found: " + stepId));
    }
}
