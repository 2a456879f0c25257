package com.example.qkd.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class QkdConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
