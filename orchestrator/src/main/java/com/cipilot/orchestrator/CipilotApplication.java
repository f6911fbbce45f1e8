package com.cipilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class CipilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CipilotApplication.class, args);
    }

    // Injected wherever branch names or timestamps are derived.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
