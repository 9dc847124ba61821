package com.quantops.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the QuantOps orchestrator.
 */
@SpringBootApplication
public class QuantOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantOpsApplication.class, args);
    }
}
