package com.foliogate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class FolioGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FolioGateApplication.class, args);
    }

    /**
     * Scheduling drives the rate limit window cleanup; tests switch it off.
     */
    @EnableScheduling
    @ConditionalOnProperty(name = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}
