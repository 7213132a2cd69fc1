package com.herzen.entanglement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }
}
