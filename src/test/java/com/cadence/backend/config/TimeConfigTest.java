package com.cadence.backend.config;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

class TimeConfigTest {

    @Test
    void outreachClock_ShouldCarryWarmupZone() {
        OutreachProperties defaults = OutreachProperties.defaults();
        OutreachProperties properties = new OutreachProperties(defaults.scheduler(),
                new OutreachProperties.Warmup(8, 21, Duration.ofMinutes(5), "America/New_York"),
                defaults.monitor(), defaults.execution());

        Clock clock = new TimeConfig().outreachClock(properties);

        assertThat(clock.getZone()).isEqualTo(ZoneId.of("America/New_York"));
    }
}
