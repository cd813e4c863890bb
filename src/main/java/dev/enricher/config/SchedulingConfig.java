package dev.enricher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * Time source for queue timestamps and staleness checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
