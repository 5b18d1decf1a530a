package com.itq.formledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Trusted time source for {@code approved_at} and ledger event timestamps. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
