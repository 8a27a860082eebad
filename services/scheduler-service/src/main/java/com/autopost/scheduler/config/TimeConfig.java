package com.autopost.scheduler.config;

import com.autopost.scheduler.ratelimit.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(AutopostProperties properties) {
        return Clock.system(properties.getPosting().getZoneId());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
