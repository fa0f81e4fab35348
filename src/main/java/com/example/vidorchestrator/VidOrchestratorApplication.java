package com.example.vidorchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidOrchestratorApplication {
    private static final Logger logger = LoggerFactory.getLogger(
            VidOrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VidOrchestratorApplication.class, args);
        logger.info("Application started");
    }
}
