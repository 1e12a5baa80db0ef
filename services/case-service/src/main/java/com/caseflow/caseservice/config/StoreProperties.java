package com.caseflow.caseservice.config;

import com.caseflow.uow.UnitOfWorkStrategy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Storage settings, bound from {@code caseflow.store.*}. The JDBC connection itself is configured
 * under {@code caseflow.database.*}.
 *
 * @param mode {@code in-memory} (default) or {@code jdbc}
 * @param unitOfWork how commands make append and metadata write atomic (default buffered)
 * @param lockTimeout how long an in-memory append waits for the aggregate lock (default 5s)
 */
@ConfigurationProperties(prefix = "caseflow.store")
@Validated
public record StoreProperties(String mode, UnitOfWorkStrategy unitOfWork, Duration lockTimeout) {

    public static final String IN_MEMORY = "in-memory";
    public static final String JDBC = "jdbc";

    public StoreProperties {
        if (mode == null || mode.isBlank()) {
            mode = IN_MEMORY;
        }
        if (!IN_MEMORY.equals(mode) && !JDBC.equals(mode)) {
            throw new IllegalArgumentException("caseflow.store.mode must be in-memory or jdbc, got " + mode);
        }
        if (unitOfWork == null) {
            unitOfWork = UnitOfWorkStrategy.BUFFERED;
        }
        if (lockTimeout == null || lockTimeout.isZero() || lockTimeout.isNegative()) {
            lockTimeout = Duration.ofSeconds(5);
        }
    }
}
