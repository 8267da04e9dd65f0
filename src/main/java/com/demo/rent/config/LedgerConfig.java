package com.demo.rent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /** Host clock read by every deadline and expiry comparison. */
    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
