package com.coursegen.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Course generation service.
 *
 * To run with mock providers (no credentials needed):
 *   DB_URL=jdbc:postgresql://localhost:5432/coursegen mvn -pl orchestrator spring-boot:run
 *
 * Live providers:
 *   COURSEGEN_MODE=live OPENAI_API_KEY=... DID_API_KEY=... ELEVENLABS_API_KEY=... mvn ...
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
