package com.taskboard.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Single UTC clock shared by services and JPA auditing, so audit columns and
 * explicit timestamp touches come from the same source.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public DateTimeProvider utcOffsetDateTimeProvider(Clock utcClock) {
        return () -> Optional.of(OffsetDateTime.now(utcClock));
    }
}
