package com.caseflow.caseservice;

import com.caseflow.caseservice.config.CaseServiceProperties;
import com.caseflow.caseservice.config.StoreProperties;
import com.caseflow.database.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Case service: accepts event submissions for change cases and exemption applications and serves
 * their projected state.
 *
 * <p>The store is chosen by {@code caseflow.store.mode}: {@code in-memory} (default) or
 * {@code jdbc}, which pulls in {@link DatabaseConfig} and its own DataSource and Flyway.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties({CaseServiceProperties.class, StoreProperties.class})
@Import(DatabaseConfig.class)
public class CaseServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(CaseServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CaseServiceApplication.class, args);
        log.info("Caseflow case service started");
    }
}
