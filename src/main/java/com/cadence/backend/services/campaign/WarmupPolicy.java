package com.cadence.backend.services.campaign;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Weekly ramp of the daily action cap for a sending account.
 */
@Component
public class WarmupPolicy {

    public static final int MAX_DAILY_LIMIT = 25;

    /**
     * @param warmupDay whole days since the account's first successful action
     * @return 5, 10, 15, 20 or 25
     * @throws IllegalArgumentException for a negative day
     */
    public int dailyLimit(int warmupDay) {
        if (warmupDay < 0) {
            throw new IllegalArgumentException("Warmup day must not be negative: " + warmupDay);
        }
        if (warmupDay < 7) return 5;
        if (warmupDay < 14) return 10;
        if (warmupDay < 21) return 15;
        if (warmupDay < 28) return 20;
        return MAX_DAILY_LIMIT;
    }

    /**
     * Whole days elapsed since {@code firstActionAt}; 0 when the account never sent anything.
     */
    public int warmupDay(Instant firstActionAt, Instant now) {
        if (firstActionAt == null || now.isBefore(firstActionAt)) {
            return 0;
        }
        long days = Duration.between(firstActionAt, now).toDays();
        return (int) Math.min(days, Integer.MAX_VALUE);
    }
}
