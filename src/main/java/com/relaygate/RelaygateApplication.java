package com.relaygate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Relaygate - multi-provider AI routing gateway with
 * circuit breaking, idempotent replay and cost guardrails.
 */
@SpringBootApplication
public class RelaygateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelaygateApplication.class, args);
    }
}
