package com.caseflow.database.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the relational event store.
 *
 * <pre>{@code
 * caseflow:
 *   database:
 *     url: jdbc:postgresql://localhost:5432/caseflow
 *     username: caseflow
 *     password: caseflow_dev_password
 *     locations: classpath:db/migration/caseflow
 *     statement-timeout: 5s
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database username
 * @param password database password
 * @param locations Flyway migration locations (default {@code classpath:db/migration/caseflow})
 * @param statementTimeout bound on every event store statement and transaction (default 5s)
 */
@Validated
@ConfigurationProperties(prefix = "caseflow.database")
public record DatabaseProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        Duration statementTimeout) {

    /** Default migration location. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/caseflow";

    public DatabaseProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (statementTimeout == null || statementTimeout.isZero() || statementTimeout.isNegative()) {
            statementTimeout = Duration.ofSeconds(5);
        }
    }
}
