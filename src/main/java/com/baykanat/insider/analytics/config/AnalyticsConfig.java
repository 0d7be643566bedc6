package com.baykanat.insider.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Zaman pencerelerinin "şimdi"si için ortak saat; testlerde sabitlenir. */
@Configuration
public class AnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
