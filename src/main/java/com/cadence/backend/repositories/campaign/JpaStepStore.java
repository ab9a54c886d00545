package com.cadence.backend.repositories.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaStepStore implements StepStore {

    private final ScheduledStepRepository stepRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean insertIfAbsent(ScheduledStep step) {
        if (stepRepository.existsByCampaignIdAndContactIdAndStepIndex(
                step.getCampaignId(), step.getContactId(), step.getStepIndex())) {
            return false;
        }
        try {
            stepRepository.saveAndFlush(step);
            return true;
        } catch (DataIntegrityViolationException e) {
            // Concurrent insert of the same (campaign, contact, stepIndex) won the race
            log.debug("Step for campaign {} contact {} index {} already exists",
                    step.getCampaignId(), step.getContactId(), step.getStepIndex());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledStep> findById(Long stepId) {
        return stepRepository.findById(stepId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findDue(Instant now) {
        return stepRepository.findDueSteps(StepStatus.SCHEDULABLE, now);
    }

    @Override
    @Transactional
    public boolean claim(Long stepId, StepStatus expected, Instant now) {
        return stepRepository.claim(stepId, expected, StepStatus.EXECUTING, now) == 1;
    }

    @Override
    @Transactional
    public boolean transition(Long stepId, StepStatus expected, StepStatus next, Instant now) {
        return stepRepository.transition(stepId, expected, next, now) == 1;
    }

    @Override
    @Transactional
    public boolean recordOutcome(Long stepId, StepStatus outcome, Instant executedAt,
                                 ErrorCategory errorCategory, String errorMessage, Instant now) {
        return stepRepository.recordOutcome(stepId, StepStatus.EXECUTING, outcome, executedAt,
                errorCategory, errorMessage, now) == 1;
    }

    @Override
    @Transactional
    public boolean resetToPending(Long stepId, StepStatus expected, Instant scheduledAt, Instant now) {
        return stepRepository.resetToPending(stepId, expected, StepStatus.PENDING, scheduledAt, now) == 1;
    }

    @Override
    @Transactional
    public boolean approve(Long stepId, String approverId, Instant now) {
        return stepRepository.approve(stepId, StepStatus.REQUIRES_APPROVAL, StepStatus.APPROVED,
                approverId, now) == 1;
    }

    @Override
    @Transactional
    public boolean reject(Long stepId, String approverId, String reason, Instant now) {
        return stepRepository.reject(stepId, StepStatus.REQUIRES_APPROVAL, StepStatus.SKIPPED,
                approverId, reason, now) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findFailed(Long campaignId, ErrorCategory category, Collection<Long> contactIds) {
        List<ScheduledStep> failed = stepRepository.findByStatusAndFilters(StepStatus.FAILED, campaignId, category);
        if (contactIds == null || contactIds.isEmpty()) {
            return failed;
        }
        Set<Long> wanted = Set.copyOf(contactIds);
        return failed.stream()
                .filter(step -> wanted.contains(step.getContactId()))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findStaleExecuting(Instant updatedBefore) {
        return stepRepository.findByStatusAndUpdatedAtBeforeOrderByIdAsc(StepStatus.EXECUTING, updatedBefore);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findByCampaign(Long campaignId) {
        return stepRepository.findByCampaignIdOrderByContactIdAscStepIndexAsc(campaignId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findPending(Long campaignId, Channel channel) {
        return stepRepository.findByCampaignIdAndChannelAndStatusOrderByIdAsc(campaignId, channel, StepStatus.PENDING);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledStep> findAwaitingApproval(Long workspaceId) {
        return stepRepository.findByWorkspaceIdAndStatusOrderByScheduledAtDesc(workspaceId, StepStatus.REQUIRES_APPROVAL);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> findFirstActionAt(Long workspaceId) {
        return Optional.ofNullable(stepRepository.findFirstExecutedAt(workspaceId, StepStatus.EXECUTED));
    }

    @Override
    @Transactional(readOnly = true)
    public long countExecutedBetween(Long workspaceId, Instant from, Instant to) {
        return stepRepository.countExecutedBetween(workspaceId, StepStatus.EXECUTED, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public long countInFlightBetween(Long workspaceId, Instant from, Instant to) {
        return stepRepository.countClaimedBetween(workspaceId, StepStatus.EXECUTING, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<StepStatus, Long> countByStatus(Long campaignId) {
        Map<StepStatus, Long> counts = new EnumMap<>(StepStatus.class);
        for (Object[] row : stepRepository.countByStatus(campaignId)) {
            counts.put((StepStatus) row[0], (Long) row[1]);
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FailureCount> countFailuresByCategory(Long campaignId) {
        return stepRepository.countFailuresByCategory(campaignId, StepStatus.FAILED).stream()
                .map(row -> new FailureCount(
                        row[0] != null ? (ErrorCategory) row[0] : ErrorCategory.UNKNOWN,
                        (Long) row[1],
                        (String) row[2]))
                .collect(Collectors.toList());
    }
}
