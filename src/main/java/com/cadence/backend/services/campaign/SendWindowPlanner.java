package com.cadence.backend.services.campaign;

import com.cadence.backend.config.OutreachProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Computes send times: fixed stagger for reset batches and a random slot
 * inside the daily business window for warmup spreading.
 */
@Component
public class SendWindowPlanner {

    private final OutreachProperties.Warmup warmup;
    private final Duration resetStagger;
    private final Random random;

    public SendWindowPlanner(OutreachProperties properties, Random sendWindowRandom) {
        this.warmup = properties.warmup();
        this.resetStagger = properties.scheduler().resetStagger();
        this.random = sendWindowRandom;
        if (warmup.windowStartHour() < 0 || warmup.windowEndHour() > 24
                || warmup.windowStartHour() >= warmup.windowEndHour()) {
            throw new IllegalArgumentException(String.format("Invalid business window %d-%d",
                    warmup.windowStartHour(), warmup.windowEndHour()));
        }
    }

    /**
     * {@code now + index * stagger}
     */
    public Instant staggeredAt(Instant now, int index) {
        return now.plus(resetStagger.multipliedBy(index));
    }

    public List<Instant> staggered(Instant now, int count) {
        List<Instant> times = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            times.add(staggeredAt(now, i));
        }
        return times;
    }

    public ZoneId zone() {
        return warmup.zoneId();
    }

    public LocalDate today(Instant now) {
        return now.atZone(zone()).toLocalDate();
    }

    public Instant startOfDay(Instant now) {
        return today(now).atStartOfDay(zone()).toInstant();
    }

    /**
     * Whether {@code day} still has room for a slot at or after {@code now + minLeadTime}.
     */
    public boolean hasWindowRemaining(LocalDate day, Instant now) {
        return earliestSlot(day, now).isBefore(windowEnd(day));
    }

    /**
     * Uniformly random instant in the business window of {@code day}. For today the
     * window starts no earlier than {@code now + minLeadTime}; when that leaves nothing,
     * the slot rolls to the next day's window.
     */
    public Instant randomTimeInBusinessWindow(LocalDate day, Instant now) {
        LocalDate target = day;
        while (!hasWindowRemaining(target, now)) {
            target = target.plusDays(1);
        }
        Instant start = earliestSlot(target, now);
        long spanMillis = Duration.between(start, windowEnd(target)).toMillis();
        long offset = (long) (random.nextDouble() * spanMillis);
        return start.plusMillis(offset);
    }

    /**
     * Random slot in tomorrow's window, used when the warmup cap defers a step.
     */
    public Instant nextBusinessWindow(Instant now) {
        return randomTimeInBusinessWindow(today(now).plusDays(1), now);
    }

    private Instant earliestSlot(LocalDate day, Instant now) {
        Instant windowStart = day.atTime(warmup.windowStartHour(), 0).atZone(zone()).toInstant();
        Instant leadLimit = now.plus(warmup.minLeadTime());
        return windowStart.isAfter(leadLimit) ? windowStart : leadLimit;
    }

    private Instant windowEnd(LocalDate day) {
        if (warmup.windowEndHour() == 24) {
            return day.plusDays(1).atStartOfDay(zone()).toInstant();
        }
        return day.atTime(warmup.windowEndHour(), 0).atZone(zone()).toInstant();
    }
}
