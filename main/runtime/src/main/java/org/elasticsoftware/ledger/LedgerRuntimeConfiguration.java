/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.ledger.aggregate.AggregateRuntime;
import org.elasticsoftware.ledger.aggregate.AggregateRuntimeRegistry;
import org.elasticsoftware.ledger.aggregate.MigrationContextProvider;
import org.elasticsoftware.ledger.beans.AggregateRuntimeFactory;
import org.elasticsoftware.ledger.commands.CommandProcessor;
import org.elasticsoftware.ledger.commands.CreateCommandProcessor;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.idempotency.InMemoryIdempotencyStore;
import org.elasticsoftware.ledger.idempotency.RocksDBIdempotencyStore;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.elasticsoftware.ledger.state.InMemoryEventStore;
import org.elasticsoftware.ledger.store.EventStore;
import org.elasticsoftware.ledger.store.IdempotencyStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.List;

@Configuration
@PropertySource("classpath:ledger-runtime.properties")
public class LedgerRuntimeConfiguration {

    @Bean(name = "ledgerObjectMapper")
    public ObjectMapper ledgerObjectMapper() {
        return new Jackson2ObjectMapperBuilder()
                .modulesToInstall(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Bean(name = "ledgerDomainEventSerde")
    public DomainEventSerde domainEventSerde(@Qualifier("ledgerObjectMapper") ObjectMapper objectMapper) {
        return new DomainEventSerde(objectMapper);
    }

    @Bean(name = "ledgerEventStore")
    public EventStore eventStore() {
        return new InMemoryEventStore();
    }

    @Bean(name = "ledgerIdempotencyStore")
    @ConditionalOnProperty(name = "ledger.idempotency.store", havingValue = "in-memory", matchIfMissing = true)
    public IdempotencyStore inMemoryIdempotencyStore() {
        return new InMemoryIdempotencyStore();
    }

    @Bean(name = "ledgerIdempotencyStore", destroyMethod = "close")
    @ConditionalOnProperty(name = "ledger.idempotency.store", havingValue = "rocksdb")
    public IdempotencyStore rocksDBIdempotencyStore(@Value("${ledger.rocksdb.baseDir}") String baseDir,
                                                    @Value("${ledger.rocksdb.lock-timeout-ms:1000}") long lockTimeoutMillis) {
        return new RocksDBIdempotencyStore(baseDir, lockTimeoutMillis);
    }

    @Bean(name = "ledgerIdempotencyResolver")
    public IdempotencyResolver idempotencyResolver(@Qualifier("ledgerIdempotencyStore") IdempotencyStore idempotencyStore) {
        return new IdempotencyResolver(idempotencyStore);
    }

    @Bean(name = "ledgerAggregateRuntimeFactory")
    public AggregateRuntimeFactory aggregateRuntimeFactory(@Qualifier("ledgerEventStore") EventStore eventStore,
                                                           @Qualifier("ledgerDomainEventSerde") DomainEventSerde serde,
                                                           ObjectProvider<MigrationContextProvider> migrationContextProvider,
                                                           @Qualifier("ledgerIdempotencyResolver") IdempotencyResolver idempotencyResolver) {
        return new AggregateRuntimeFactory(
                eventStore,
                serde,
                migrationContextProvider.getIfAvailable(() -> MigrationContextProvider.EMPTY),
                idempotencyResolver);
    }

    @Bean(name = "ledgerAggregateRuntimeRegistry")
    public AggregateRuntimeRegistry aggregateRuntimeRegistry(List<AggregateRuntime<?>> runtimes) {
        return new AggregateRuntimeRegistry(runtimes);
    }

    @Bean(name = "ledgerCreateCommandProcessor")
    public CreateCommandProcessor createCommandProcessor(@Qualifier("ledgerAggregateRuntimeRegistry") AggregateRuntimeRegistry registry,
                                                         @Qualifier("ledgerIdempotencyResolver") IdempotencyResolver idempotencyResolver,
                                                         @Value("${ledger.create.max-attempts:3}") int maxAttempts,
                                                         @Value("${ledger.create.append-retries:1}") int appendRetries) {
        return new CreateCommandProcessor(registry, idempotencyResolver, maxAttempts, appendRetries);
    }

    @Bean(name = "ledgerCommandProcessor")
    public CommandProcessor commandProcessor(@Qualifier("ledgerAggregateRuntimeRegistry") AggregateRuntimeRegistry registry,
                                             @Value("${ledger.command.max-attempts:3}") int maxAttempts) {
        return new CommandProcessor(registry, maxAttempts);
    }
}
