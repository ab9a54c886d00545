package com.cadence.backend.services.campaign;

import com.cadence.backend.config.OutreachProperties;
import com.cadence.backend.dto.campaign.response.ResetResultDto;
import com.cadence.backend.enums.ErrorCategory;
import com.cadence.backend.enums.StepStatus;
import com.cadence.backend.models.campaign.ScheduledStep;
import com.cadence.backend.repositories.campaign.StepStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Operator-driven recovery: failed and abandoned (stale executing) steps go back to PENDING,
 * spread out by the reset stagger so a batch never fires at once.
 *
 * Resetting is a compare-and-set from the observed status, so running a reset twice only
 * changes each step once.
 */
@Service
@Slf4j
public class StepRecoveryService {

    private final StepStore stepStore;
    private final SendWindowPlanner sendWindowPlanner;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final OutreachProperties.Scheduler schedulerProperties;

    public StepRecoveryService(StepStore stepStore,
                               SendWindowPlanner sendWindowPlanner,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               OutreachProperties properties) {
        this.stepStore = stepStore;
        this.sendWindowPlanner = sendWindowPlanner;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.schedulerProperties = properties.scheduler();
    }

    /**
     * Reset failed steps, optionally narrowed to one campaign, one error category
     * and/or a contact subset.
     */
    public ResetResultDto resetFailed(Long campaignId, ErrorCategory category, Collection<Long> contactIds) {
        List<ScheduledStep> failed = stepStore.findFailed(campaignId, category, contactIds);
        if (failed.isEmpty()) {
            return ResetResultDto.empty("No failed steps to reset");
        }
        return resetInStagger(failed, clock.instant(), "failed");
    }

    /**
     * Reset steps left EXECUTING longer than the stale threshold; their adapter call is presumed lost.
     */
    public ResetResultDto resetStaleExecuting() {
        Instant now = clock.instant();
        List<ScheduledStep> stale = findStale(now);
        if (stale.isEmpty()) {
            return ResetResultDto.empty("No stale executing steps");
        }
        return resetInStagger(stale, now, "stale");
    }

    /**
     * Failed and stale steps across all campaigns, as one staggered batch ordered by id.
     */
    public ResetResultDto resetAllFailedAndStale() {
        Instant now = clock.instant();
        List<ScheduledStep> candidates = new ArrayList<>(stepStore.findFailed(null, null, null));
        candidates.addAll(findStale(now));
        if (candidates.isEmpty()) {
            return ResetResultDto.empty("No failed or stale steps to reset");
        }
        candidates.sort(Comparator.comparing(ScheduledStep::getId));
        return resetInStagger(candidates, now, "failed_or_stale");
    }

    /**
     * Optional background sweep, off unless {@code outreach.scheduler.stale-sweep-enabled=true}.
     */
    @Scheduled(fixedDelayString = "${outreach.scheduler.stale-sweep-interval-ms:300000}")
    public void sweepStaleSteps() {
        if (!schedulerProperties.staleSweepEnabled()) {
            return;
        }
        try {
            ResetResultDto result = resetStaleExecuting();
            if (result.getResetCount() > 0) {
                log.info("Stale sweep: {}", result.getMessage());
            }
        } catch (Exception e) {
            log.error("Error in stale step sweep: {}", e.getMessage(), e);
        }
    }

    private List<ScheduledStep> findStale(Instant now) {
        return stepStore.findStaleExecuting(now.minus(schedulerProperties.staleThreshold()));
    }

    private ResetResultDto resetInStagger(List<ScheduledStep> steps, Instant now, String reason) {
        List<Long> resetIds = new ArrayList<>();
        Instant first = null;
        Instant last = null;

        for (ScheduledStep step : steps) {
            Instant scheduledAt = sendWindowPlanner.staggeredAt(now, resetIds.size());
            if (stepStore.resetToPending(step.getId(), step.getStatus(), scheduledAt, now)) {
                resetIds.add(step.getId());
                if (first == null) {
                    first = scheduledAt;
                }
                last = scheduledAt;
            } else {
                log.debug("Step {} changed state before reset, skipping", step.getId());
            }
        }

        if (!resetIds.isEmpty()) {
            Counter.builder("outreach.steps.reset")
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment(resetIds.size());
        }

        long spreadMinutes = first != null ? Duration.between(first, last).toMinutes() : 0;
        log.info("Reset {} {} step(s), staggered over {} minute(s)", resetIds.size(), reason, spreadMinutes);
        String message = String.format("Reset %d %s step(s), staggered over %d minute(s)",
                resetIds.size(), reason.replace('_', ' '), spreadMinutes);

        return ResetResultDto.builder()
                .resetCount(resetIds.size())
                .stepIds(resetIds)
                .firstScheduledAt(first)
                .lastScheduledAt(last)
                .message(message)
                .build();
    }
}
