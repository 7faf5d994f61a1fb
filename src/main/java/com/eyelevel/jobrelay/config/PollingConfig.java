package com.eyelevel.jobrelay.config;

import com.eyelevel.jobrelay.service.poll.Sleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources for identifiers, timestamps and polling. Both can be replaced with test doubles.
 */
@Configuration
public class PollingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
