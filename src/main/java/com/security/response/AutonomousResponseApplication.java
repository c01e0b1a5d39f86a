package com.security.response;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Autonomous Response Engine. Enables:
 * <ul>
 *   <li>Multi-source evidence correlation into a confidence score</li>
 *   <li>Confidence-gated proposals: auto-approve, human review or monitor only</li>
 *   <li>Background execution of approved containment actions with circuit breakers (Resilience4j)</li>
 *   <li>Append-only audit trail and Kafka lifecycle events</li>
 *   <li>Operator REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class AutonomousResponseApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutonomousResponseApplication.class, args);
    }
}
