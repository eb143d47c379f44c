package com.enterprise.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocumentOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentOrchestratorApplication.class, args);
    }
}
