package com.kotsin.snapshot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;


/**
 * Spring Boot application hosting the indicator snapshot engine.
 */
@SpringBootApplication
@EnableScheduling
public class SnapshotEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapshotEngineApplication.class, args);
    }
}
