package com.caseflow.caseservice.config;

import com.caseflow.eventstore.InMemoryEventStore;
import com.caseflow.eventstore.metadata.InMemoryCaseMetadataRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** In-process stores, used unless {@code caseflow.store.mode=jdbc}. */
@Configuration
@ConditionalOnProperty(
        prefix = "caseflow.store",
        name = "mode",
        havingValue = StoreProperties.IN_MEMORY,
        matchIfMissing = true)
public class InMemoryStoreConfig {

    @Bean
    public InMemoryEventStore inMemoryEventStore(StoreProperties properties) {
        return new InMemoryEventStore(properties.lockTimeout());
    }

    @Bean
    public InMemoryCaseMetadataRepository inMemoryCaseMetadataRepository() {
        return new InMemoryCaseMetadataRepository();
    }
}
