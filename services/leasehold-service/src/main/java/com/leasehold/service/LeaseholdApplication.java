package com.leasehold.service;

import com.leasehold.service.config.LeaseholdProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Leasehold service: accepts actions, previews, withdrawals and operator appointments for rentable
 * entities and routes them through the policy engine to the entity vaults.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation from {@code X-Correlation-ID}
 *   <li>RFC 7807 ProblemDetail error responses
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(LeaseholdProperties.class)
public class LeaseholdApplication {

    private static final Logger log = LoggerFactory.getLogger(LeaseholdApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LeaseholdApplication.class, args);
        log.info("Leasehold service started");
    }
}
