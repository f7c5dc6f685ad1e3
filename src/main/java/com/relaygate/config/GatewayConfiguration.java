package com.relaygate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GatewayConfiguration {

    /**
     * UTC clock shared by budget windows, rate limiting and idempotency expiry.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
