package com.omniguard.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * OmniGuard API application: content gate, daily quota, message encryption and
 * tamper-evident audit log for outgoing chat messages.
 */
@SpringBootApplication
@EnableScheduling
public class OmniGuardApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmniGuardApiApplication.class, args);
    }
}
