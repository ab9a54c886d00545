package com.cadence.backend.services.campaign;

import com.cadence.backend.enums.Channel;
import com.cadence.backend.repositories.campaign.StepStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account daily cap derived from the warmup ramp. All channels of an account share one cap.
 *
 * Each scheduling pass opens its own {@link Pass}. The per-account window is read through from the
 * {@link StepStore} once per pass and then tallied in memory, so admissions within a pass see each
 * other while overlapping passes never share a tally. The store stays the only authoritative source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WarmupRateLimiter {

    private final StepStore stepStore;
    private final WarmupPolicy warmupPolicy;
    private final SendWindowPlanner sendWindowPlanner;

    public Pass openPass() {
        return new Pass();
    }

    /**
     * Current warmup position of the account, read straight from the store.
     */
    public WarmupSnapshot snapshot(Long accountId, Instant now) {
        AccountWindow window = loadWindow(accountId, now);
        return new WarmupSnapshot(window.warmupDay, window.dailyLimit, window.usedToday);
    }

    private AccountWindow loadWindow(Long accountId, Instant now) {
        Instant firstActionAt = stepStore.findFirstActionAt(accountId).orElse(null);
        int warmupDay = warmupPolicy.warmupDay(firstActionAt, now);
        int dailyLimit = warmupPolicy.dailyLimit(warmupDay);
        Instant startOfDay = sendWindowPlanner.startOfDay(now);
        long usedToday = stepStore.countExecutedBetween(accountId, startOfDay, now)
                + stepStore.countInFlightBetween(accountId, startOfDay, now);
        return new AccountWindow(warmupDay, dailyLimit, (int) usedToday);
    }

    /**
     * Admission tally of one scheduling pass.
     */
    public class Pass {

        private final ConcurrentHashMap<Long, AccountWindow> windows = new ConcurrentHashMap<>();

        private Pass() {
        }

        /**
         * Admit or defer one action for the account. An admission reserves a slot in
         * this pass's tally; nothing is written to the store.
         */
        public RateDecision admit(Long accountId, Channel channel, Instant now) {
            AccountWindow window = windows.computeIfAbsent(accountId, id -> loadWindow(id, now));

            synchronized (window) {
                if (window.usedToday < window.dailyLimit) {
                    window.usedToday++;
                    return RateDecision.admit(window.warmupDay, window.dailyLimit, window.usedToday);
                }
            }

            Instant nextEligibleAt = sendWindowPlanner.nextBusinessWindow(now);
            log.debug("Account {} reached warmup cap {} (day {}), deferring {} to {}",
                    accountId, window.dailyLimit, window.warmupDay, channel, nextEligibleAt);
            return RateDecision.defer(nextEligibleAt, window.warmupDay, window.dailyLimit, window.usedToday);
        }
    }

    // Helper classes
    private static class AccountWindow {
        final int warmupDay;
        final int dailyLimit;
        int usedToday;

        AccountWindow(int warmupDay, int dailyLimit, int usedToday) {
            this.warmupDay = warmupDay;
            this.dailyLimit = dailyLimit;
            this.usedToday = usedToday;
        }
    }

    public static class RateDecision {
        private final boolean admitted;
        private final Instant nextEligibleAt;
        private final int warmupDay;
        private final int dailyLimit;
        private final int usedToday;

        private RateDecision(boolean admitted, Instant nextEligibleAt, int warmupDay, int dailyLimit, int usedToday) {
            this.admitted = admitted;
            this.nextEligibleAt = nextEligibleAt;
            this.warmupDay = warmupDay;
            this.dailyLimit = dailyLimit;
            this.usedToday = usedToday;
        }

        public static RateDecision admit(int warmupDay, int dailyLimit, int usedToday) {
            return new RateDecision(true, null, warmupDay, dailyLimit, usedToday);
        }

        public static RateDecision defer(Instant nextEligibleAt, int warmupDay, int dailyLimit, int usedToday) {
            return new RateDecision(false, nextEligibleAt, warmupDay, dailyLimit, usedToday);
        }

        public boolean isAdmitted() { return admitted; }
        public Instant getNextEligibleAt() { return nextEligibleAt; }
        public int getWarmupDay() { return warmupDay; }
        public int getDailyLimit() { return dailyLimit; }
        public int getUsedToday() { return usedToday; }
    }

    public record WarmupSnapshot(int warmupDay, int dailyLimit, int sentToday) {
        public int remainingToday() {
            return Math.max(0, dailyLimit - sentToday);
        }
    }
}
