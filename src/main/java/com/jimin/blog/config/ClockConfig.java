package com.jimin.blog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // updatedAt 갱신 기준 시계 (UTC)
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
