package com.cadence.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "outreach")
public record OutreachProperties(
        @DefaultValue Scheduler scheduler,
        @DefaultValue Warmup warmup,
        @DefaultValue Monitor monitor,
        @DefaultValue Execution execution
) {

    public static OutreachProperties defaults() {
        return new OutreachProperties(
                new Scheduler(60000L, Duration.ofMinutes(3), Duration.ofMinutes(5), Duration.ofSeconds(90),
                        false, 300000L),
                new Warmup(8, 21, Duration.ofMinutes(5), "UTC"),
                new Monitor(0),
                new Execution(true));
    }

    public record Scheduler(
            @DefaultValue("60000") long intervalMs,
            @DefaultValue("3m") Duration executionTimeout,
            @DefaultValue("5m") Duration staleThreshold,
            @DefaultValue("90s") Duration resetStagger,
            @DefaultValue("false") boolean staleSweepEnabled,
            @DefaultValue("300000") long staleSweepIntervalMs
    ) {
    }

    /**
     * Business window used when spreading warmup-limited sends across days.
     * Hours are local to {@code zone}; the end hour is exclusive.
     */
    public record Warmup(
            @DefaultValue("8") int windowStartHour,
            @DefaultValue("21") int windowEndHour,
            @DefaultValue("5m") Duration minLeadTime,
            @DefaultValue("UTC") String zone
    ) {
        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * @param trendMinEvents combined event count of both 24h windows below which the trend is reported as stable
     */
    public record Monitor(
            @DefaultValue("0") int trendMinEvents
    ) {
    }

    public record Execution(
            @DefaultValue("true") boolean dryRun
    ) {
    }
}
