package com.caseflow.database.config;

import com.caseflow.database.JdbcCaseMetadataRepository;
import com.caseflow.database.JdbcEventStore;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

/**
 * Wires the relational event store when {@code caseflow.store.mode=jdbc}.
 *
 * <p>Creates the DataSource from {@link DatabaseProperties}, runs the Flyway migrations on startup,
 * and exposes the JDBC event store and metadata repository. Services importing this class should
 * disable Spring Boot's own DataSource and Flyway auto-configuration:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
@ConditionalOnProperty(prefix = "caseflow.store", name = "mode", havingValue = "jdbc")
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    /** Bean name of the Flyway instance that migrates the event store schema. */
    public static final String CASEFLOW_FLYWAY_BEAN = "caseflowFlyway";

    @Bean
    public DataSource caseflowDataSource(DatabaseProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    /**
     * Creates the Flyway instance and migrates on startup.
     *
     * @return configured Flyway instance; migration runs as its init method
     */
    @Bean(name = CASEFLOW_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway caseflowFlyway(DataSource caseflowDataSource, DatabaseProperties properties) {
        log.info("Configuring Flyway for {} with locations {}", properties.url(), properties.locations());
        return createFlyway(caseflowDataSource, properties.locations());
    }

    @Bean
    @DependsOn(CASEFLOW_FLYWAY_BEAN)
    public JdbcEventStore jdbcEventStore(DataSource caseflowDataSource, DatabaseProperties properties) {
        return new JdbcEventStore(caseflowDataSource, properties.statementTimeout());
    }

    @Bean
    @DependsOn(CASEFLOW_FLYWAY_BEAN)
    public JdbcCaseMetadataRepository jdbcCaseMetadataRepository(DataSource caseflowDataSource) {
        return new JdbcCaseMetadataRepository(caseflowDataSource);
    }

    /** Creates a configured Flyway instance for the given DataSource and locations. */
    public static Flyway createFlyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
