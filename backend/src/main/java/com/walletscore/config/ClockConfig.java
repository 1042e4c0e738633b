package com.walletscore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Wall clock for window bounds, wallet age and cache timestamps. Tests pin it with Clock.fixed. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
