package com.cadence.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The one clock behind every "now" in the engine: scheduler passes, claim and outcome
 * timestamps, stale-executing cutoffs, approval and engagement event times, and the
 * 24h windows of the campaign monitor. Tests swap in {@link Clock#fixed}.
 */
@Configuration
public class TimeConfig {

    /**
     * System time carrying the warmup zone, so local dates read off this clock match the
     * business windows the send planner computes.
     */
    @Bean
    public Clock outreachClock(OutreachProperties properties) {
        return Clock.system(properties.warmup().zoneId());
    }
}
