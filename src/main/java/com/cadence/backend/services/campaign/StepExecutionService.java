package com.cadence.backend.services.campaign;

import com.cadence.backend.config.OutreachProperties;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.ExecutionOutcome;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import com.cadence.backend.services.execution.ExecutionAdapter;
import com.cadence.backend.services.execution.ExecutionAdapterRegistry;
import com.cadence.backend.services.execution.ExecutionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the adapter call for a claimed step on the outreach worker pool and writes the outcome back.
 *
 * Every outcome write is conditional on the step still being EXECUTING, so a step that an
 * operator reset while the adapter was busy keeps its new state. A call that outlives the
 * execution timeout has its worker interrupted so hung adapters cannot pin the pool.
 */
@Service
@Slf4j
public class StepExecutionService {

    private final StepStore stepStore;
    private final ExecutionAdapterRegistry adapterRegistry;
    private final EngagementEventService engagementEventService;
    private final SendWindowPlanner sendWindowPlanner;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor executor;
    private final Duration executionTimeout;

    public StepExecutionService(StepStore stepStore,
                                ExecutionAdapterRegistry adapterRegistry,
                                EngagementEventService engagementEventService,
                                SendWindowPlanner sendWindowPlanner,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Qualifier("outreachExecutor") Executor executor,
                                OutreachProperties properties) {
        this.stepStore = stepStore;
        this.adapterRegistry = adapterRegistry;
        this.engagementEventService = engagementEventService;
        this.sendWindowPlanner = sendWindowPlanner;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.executor = executor;
        this.executionTimeout = properties.scheduler().executionTimeout();
    }

    /**
     * Start the adapter call for a step already claimed as EXECUTING. The returned future
     * completes once the outcome is recorded, or once the timeout expires.
     */
    public CompletableFuture<ExecutionOutcome> dispatch(ScheduledStep step) {
        Optional<ExecutionAdapter> adapter = adapterRegistry.forChannel(step.getChannel());
        if (adapter.isEmpty()) {
            return CompletableFuture.completedFuture(recordFailure(step, ErrorCategory.DESTINATION_ACCOUNT_NOT_LINKED,
                    "No execution adapter registered for channel " + step.getChannel()));
        }

        log.debug("Dispatching step {} ({}) to {}", step.getId(), step.getChannel(),
                adapter.get().getClass().getSimpleName());

        AtomicReference<Thread> worker = new AtomicReference<>();
        CompletableFuture<ExecutionResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> {
                worker.set(Thread.currentThread());
                try {
                    return adapter.get().execute(step);
                } finally {
                    worker.set(null);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(releaseClaim(step));
        }

        return call
                .orTimeout(executionTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (isTimeout(error)) {
                        Thread hung = worker.getAndSet(null);
                        if (hung != null) {
                            hung.interrupt();
                        }
                    }
                    return settle(step, result, error);
                });
    }

    private static boolean isTimeout(Throwable error) {
        return error instanceof TimeoutException
                || (error instanceof CompletionException && error.getCause() instanceof TimeoutException);
    }

    ExecutionOutcome settle(ScheduledStep step, ExecutionResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TimeoutException) {
                log.warn("Adapter for step {} did not answer within {}, leaving it executing for stale recovery",
                        step.getId(), executionTimeout);
                countOutcome(step, ExecutionOutcome.TIMED_OUT);
                return ExecutionOutcome.TIMED_OUT;
            }
            log.error("Adapter failed for step {}: {}", step.getId(), cause.getMessage(), cause);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return recordFailure(step, ErrorCategory.OTHER_ERROR, message);
        }

        if (result == null) {
            return recordFailure(step, ErrorCategory.OTHER_ERROR, "Execution adapter returned no result");
        }
        if (result.isSuccess()) {
            return recordSuccess(step);
        }
        if (result.isWarmupDeferral()) {
            return recordDeferral(step, sendWindowPlanner.nextBusinessWindow(clock.instant()));
        }
        return recordFailure(step, result.getErrorCategory(), result.getMessage());
    }

    // =========================
    // OUTCOME WRITES
    // =========================

    public ExecutionOutcome recordSuccess(ScheduledStep step) {
        Instant now = clock.instant();
        StepStatus status = step.getChannel().successStatus();

        if (!stepStore.recordOutcome(step.getId(), status, now, null, null, now)) {
            return discard(step, status.name());
        }

        engagementEventService.recordSent(step, now);
        ExecutionOutcome outcome = ExecutionOutcome.fromStatus(status);
        countOutcome(step, outcome);
        log.info("Step {} for contact {} {}", step.getId(), step.getContactId(), status.getDisplayName().toLowerCase());
        return outcome;
    }

    public ExecutionOutcome recordFailure(ScheduledStep step, ErrorCategory category, String message) {
        Instant now = clock.instant();
        ErrorCategory errorCategory = category != null ? category : ErrorCategory.UNKNOWN;
        String errorMessage = message != null && !message.isBlank() ? message : errorCategory.getLabel();

        if (!stepStore.recordOutcome(step.getId(), StepStatus.FAILED, now, errorCategory, errorMessage, now)) {
            return discard(step, StepStatus.FAILED.name());
        }

        countOutcome(step, ExecutionOutcome.FAILED);
        log.warn("Step {} for contact {} failed [{}]: {}",
                step.getId(), step.getContactId(), errorCategory.getCode(), errorMessage);
        return ExecutionOutcome.FAILED;
    }

    /**
     * Back to PENDING at {@code nextEligibleAt}. Not a failure: no error fields are written.
     */
    public ExecutionOutcome recordDeferral(ScheduledStep step, Instant nextEligibleAt) {
        Instant now = clock.instant();
        if (!stepStore.resetToPending(step.getId(), StepStatus.EXECUTING, nextEligibleAt, now)) {
            return discard(step, StepStatus.PENDING.name());
        }

        countOutcome(step, ExecutionOutcome.DEFERRED);
        log.info("Step {} deferred by warmup limit to {}", step.getId(), nextEligibleAt);
        return ExecutionOutcome.DEFERRED;
    }

    /**
     * Hand a claimed step back unchanged when no worker could take it. Same scheduledAt, no error.
     */
    ExecutionOutcome releaseClaim(ScheduledStep step) {
        if (!stepStore.resetToPending(step.getId(), StepStatus.EXECUTING, step.getScheduledAt(), clock.instant())) {
            return discard(step, StepStatus.PENDING.name());
        }

        countOutcome(step, ExecutionOutcome.RELEASED);
        log.warn("Outreach worker pool is full, released step {} for the next pass", step.getId());
        return ExecutionOutcome.RELEASED;
    }

    private ExecutionOutcome discard(ScheduledStep step, String attempted) {
        log.warn("Dropped {} outcome for step {}: it is no longer executing", attempted, step.getId());
        countOutcome(step, ExecutionOutcome.DISCARDED);
        return ExecutionOutcome.DISCARDED;
    }

    private void countOutcome(ScheduledStep step, ExecutionOutcome outcome) {
        Counter.builder("outreach.steps.executed")
                .tag("outcome", outcome.name().toLowerCase())
                .tag("channel", step.getChannel().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }
}
