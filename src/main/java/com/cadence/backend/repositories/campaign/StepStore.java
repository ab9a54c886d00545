package com.cadence.backend.repositories.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable collection of {@link ScheduledStep} records.
 *
 * Every state-changing method is a compare-and-set on the stored status and
 * returns {@code false} when the row was not in the expected state. That
 * conditional update is the only mutual exclusion the engine relies on when
 * several scheduler instances run against the same store.
 */
public interface StepStore {

    /**
     * Insert a new step. A step with the same (campaignId, contactId, stepIndex)
     * already present makes this a no-op returning {@code false}.
     */
    boolean insertIfAbsent(ScheduledStep step);

    Optional<ScheduledStep> findById(Long stepId);

    /**
     * Pending or approved steps with scheduledAt at or before {@code now},
     * ordered by scheduledAt then id.
     */
    List<ScheduledStep> findDue(Instant now);

    /**
     * {@code expected -> EXECUTING}, refused while another step of the same
     * contact and channel is executing.
     */
    boolean claim(Long stepId, StepStatus expected, Instant now);

    boolean transition(Long stepId, StepStatus expected, StepStatus next, Instant now);

    /**
     * {@code EXECUTING -> outcome}. Error fields are only meaningful for FAILED.
     */
    boolean recordOutcome(Long stepId, StepStatus outcome, Instant executedAt,
                          ErrorCategory errorCategory, String errorMessage, Instant now);

    /**
     * {@code expected -> PENDING} with a new scheduledAt, clearing executedAt and error fields.
     */
    boolean resetToPending(Long stepId, StepStatus expected, Instant scheduledAt, Instant now);

    boolean approve(Long stepId, String approverId, Instant now);

    boolean reject(Long stepId, String approverId, String reason, Instant now);

    /**
     * Failed steps ordered by id. Null filters match everything; an empty
     * contact collection also matches everything.
     */
    List<ScheduledStep> findFailed(Long campaignId, ErrorCategory category, Collection<Long> contactIds);

    List<ScheduledStep> findStaleExecuting(Instant updatedBefore);

    List<ScheduledStep> findByCampaign(Long campaignId);

    List<ScheduledStep> findPending(Long campaignId, Channel channel);

    List<ScheduledStep> findAwaitingApproval(Long workspaceId);

    /**
     * Earliest executedAt of a sent or completed step for the account, across campaigns.
     */
    Optional<Instant> findFirstActionAt(Long workspaceId);

    /**
     * Sent or completed steps for the account with executedAt in {@code [from, to)}.
     */
    long countExecutedBetween(Long workspaceId, Instant from, Instant to);

    /**
     * Executing steps for the account whose claim (updatedAt) falls in {@code [from, to)}.
     */
    long countInFlightBetween(Long workspaceId, Instant from, Instant to);

    Map<StepStatus, Long> countByStatus(Long campaignId);

    List<FailureCount> countFailuresByCategory(Long campaignId);

    record FailureCount(ErrorCategory category, long count, String sampleError) {
    }
}
