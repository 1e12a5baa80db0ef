package com.caseflow.caseservice.config;

import com.caseflow.caseservice.domain.AggregateRegistry;
import com.caseflow.caseservice.notification.LoggingNotificationSink;
import com.caseflow.caseservice.notification.NotificationDispatcher;
import com.caseflow.caseservice.notification.NotificationSink;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import com.caseflow.observability.MetricFactory;
import com.caseflow.uow.UnitOfWorkFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wiring shared by both store modes. */
@Configuration
public class CaseServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(CaseServiceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AggregateRegistry aggregateRegistry() {
        return AggregateRegistry.standard();
    }

    @Bean
    public UnitOfWorkFactory unitOfWorkFactory(
            EventStore eventStore, CaseMetadataRepository metadataRepository, StoreProperties properties) {
        log.info(
                "Using {} event store with {} units of work",
                eventStore.getClass().getSimpleName(),
                properties.unitOfWork());
        return new UnitOfWorkFactory(eventStore, metadataRepository, properties.unitOfWork());
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, CaseServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public LoggingNotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(CaseServiceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.notificationThreads(), runnable -> {
            Thread thread = new Thread(runnable, "notification-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(
            List<NotificationSink> sinks, ExecutorService notificationExecutor) {
        return new NotificationDispatcher(sinks, notificationExecutor);
    }
}
