package com.cadence.backend.services.campaign;

import com.cadence.backend.dto.campaign.response.SchedulerPassDto;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.ExecutionOutcome;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Periodic driver of the outreach state machine.
 *
 * A pass claims every due step in (scheduledAt, id) order, routes it through the approval
 * gate and the warmup limiter, and hands the rest to {@link StepExecutionService}. Adapter calls
 * run on the worker pool, so a slow send never holds up the claims behind it.
 * Nothing is retried here: failures wait for an operator reset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutreachSchedulerService {

    private final StepStore stepStore;
    private final WarmupRateLimiter rateLimiter;
    private final ApprovalPolicy approvalPolicy;
    private final StepExecutionService stepExecutionService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedRateString = "${outreach.scheduler.interval-ms:60000}")
    public void processDueSteps() {
        try {
            PassResult result = runPass(clock.instant());
            if (result.getDispatched() > 0) {
                result.getCompletion().whenComplete((outcomes, error) -> {
                    if (error != null) {
                        log.error("Outreach pass at {} did not settle cleanly: {}",
                                result.getRanAt(), error.getMessage(), error);
                    } else {
                        log.info("Outreach pass at {} settled: {}", result.getRanAt(), tally(outcomes));
                    }
                });
            }
        } catch (Exception e) {
            log.error("Error in outreach scheduler pass: {}", e.getMessage(), e);
        }
    }

    /**
     * One scheduling pass at {@code now}. Returns once every due step has been claimed and
     * routed; dispatched adapter calls settle through {@link PassResult#getCompletion()}.
     */
    public PassResult runPass(Instant now) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            WarmupRateLimiter.Pass warmupPass = rateLimiter.openPass();

            List<ScheduledStep> due = stepStore.findDue(now);
            PassResult result = new PassResult(now, due.size());
            if (due.isEmpty()) {
                log.debug("No outreach steps due at {}", now);
                return result;
            }

            log.info("Processing {} due outreach steps", due.size());
            for (ScheduledStep step : due) {
                processStep(step, now, warmupPass, result);
            }

            log.info("Outreach pass at {}: claimed={}, lostClaims={}, approvalRequired={}, deferred={}, dispatched={}",
                    now, result.getClaimed(), result.getLostClaims(), result.getApprovalRequired(),
                    result.getDeferred(), result.getDispatched());
            return result;
        } finally {
            sample.stop(Timer.builder("outreach.scheduler.pass.duration")
                    .description("Time to claim and route the due outreach steps")
                    .register(meterRegistry));
        }
    }

    private void processStep(ScheduledStep step, Instant now, WarmupRateLimiter.Pass warmupPass, PassResult result) {
        StepStatus expected = step.getStatus();
        if (!stepStore.claim(step.getId(), expected, now)) {
            // Another instance took it, or the contact already has this channel in flight
            log.debug("Claim lost for step {}", step.getId());
            result.lostClaims++;
            return;
        }
        result.claimed++;
        count("outreach.steps.claimed", step);

        try {
            // An approval survives deferrals and resets
            if (expected == StepStatus.PENDING && step.getApprovedBy() == null
                    && approvalPolicy.requiresApproval(step)) {
                stepStore.transition(step.getId(), StepStatus.EXECUTING, StepStatus.REQUIRES_APPROVAL, now);
                result.approvalRequired++;
                count("outreach.steps.approval_required", step);
                log.info("Step {} for contact {} is waiting for approval", step.getId(), step.getContactId());
                return;
            }

            if (step.getChannel().isWarmupLimited()) {
                WarmupRateLimiter.RateDecision decision =
                        warmupPass.admit(step.getWorkspaceId(), step.getChannel(), now);
                if (!decision.isAdmitted()) {
                    stepStore.resetToPending(step.getId(), StepStatus.EXECUTING, decision.getNextEligibleAt(), now);
                    result.deferred++;
                    count("outreach.steps.deferred", step);
                    log.info("Step {} deferred to {} (warmup day {}, limit {})", step.getId(),
                            decision.getNextEligibleAt(), decision.getWarmupDay(), decision.getDailyLimit());
                    return;
                }
            }

            step.setStatus(StepStatus.EXECUTING);
            result.outcomes.add(stepExecutionService.dispatch(step));

        } catch (Exception e) {
            log.error("Failed to process step {}: {}", step.getId(), e.getMessage(), e);
            try {
                stepExecutionService.recordFailure(step, ErrorCategory.OTHER_ERROR, e.getMessage());
            } catch (Exception recordError) {
                log.error("Could not record failure for step {}, it stays executing until a stale reset",
                        step.getId(), recordError);
            }
        }
    }

    private void count(String name, ScheduledStep step) {
        Counter.builder(name)
                .tag("channel", step.getChannel().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    private static Map<ExecutionOutcome, Integer> tally(List<ExecutionOutcome> outcomes) {
        Map<ExecutionOutcome, Integer> counts = new EnumMap<>(ExecutionOutcome.class);
        outcomes.forEach(outcome -> counts.merge(outcome, 1, Integer::sum));
        return counts;
    }

    @Getter
    public static class PassResult {
        private final Instant ranAt;
        private final int due;
        private int claimed;
        private int lostClaims;
        private int approvalRequired;
        private int deferred;
        @Getter(lombok.AccessLevel.NONE)
        private final List<CompletableFuture<ExecutionOutcome>> outcomes = new ArrayList<>();

        PassResult(Instant ranAt, int due) {
            this.ranAt = ranAt;
            this.due = due;
        }

        public int getDispatched() {
            return outcomes.size();
        }

        /**
         * Completes with every dispatched outcome, in dispatch order.
         */
        public CompletableFuture<List<ExecutionOutcome>> getCompletion() {
            return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
                    .thenApply(v -> outcomes.stream().map(CompletableFuture::join).toList());
        }

        public SchedulerPassDto toDto() {
            return SchedulerPassDto.builder()
                    .ranAt(ranAt)
                    .due(due)
                    .claimed(claimed)
                    .lostClaims(lostClaims)
                    .approvalRequired(approvalRequired)
                    .deferred(deferred)
                    .dispatched(getDispatched())
                    .build();
        }
    }
}
