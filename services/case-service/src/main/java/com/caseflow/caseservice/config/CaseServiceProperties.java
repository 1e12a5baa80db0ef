package com.caseflow.caseservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and notification settings, bound from {@code caseflow.service.*}.
 *
 * <pre>
 * caseflow:
 *   service:
 *     name: case-service
 *     environment: production
 *     notification-threads: 2
 * </pre>
 *
 * @param name service name, used as the metrics service tag
 * @param environment deployment environment (default development)
 * @param notificationThreads threads delivering committed events to sinks (default 2)
 */
@ConfigurationProperties(prefix = "caseflow.service")
@Validated
public record CaseServiceProperties(@NotBlank String name, String environment, int notificationThreads) {

    public CaseServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (notificationThreads <= 0) {
            notificationThreads = 2;
        }
    }
}
