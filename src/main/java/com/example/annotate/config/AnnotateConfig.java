package com.example.annotate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnnotateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
