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

package org.elasticsoftware.ledger.aggregate;

import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.commands.Command;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.elasticsoftware.ledger.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class EventStoreAggregateRuntime<S extends AggregateState> extends AggregateRuntimeBase<S> {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreAggregateRuntime.class);
    private final EventStore eventStore;
    private final IdempotencyResolver idempotencyResolver;

    public EventStoreAggregateRuntime(Aggregate<S> aggregate,
                                      String name,
                                      AggregateFolder<S> folder,
                                      EventSchemaMigrator migrator,
                                      Map<Class<?>, CommandHandlerFunction<S, Command, DomainEvent>> commandHandlers,
                                      DomainEventSerde serde,
                                      MigrationContextProvider migrationContextProvider,
                                      EventStore eventStore,
                                      IdempotencyResolver idempotencyResolver) {
        super(aggregate, name, folder, migrator, commandHandlers, serde, migrationContextProvider);
        this.eventStore = eventStore;
        this.idempotencyResolver = idempotencyResolver;
    }

    @Override
    public Optional<AggregateView<S>> load(String aggregateId) {
        List<DomainEventRecord> records = eventStore.load(getName(), aggregateId);
        logger.trace("Loaded {} events for {} with id {}", records.size(), getName(), aggregateId);
        return Optional.ofNullable(materialize(aggregateId, records));
    }

    @Override
    public Optional<AggregateView<S>> findByExternalId(String owner, String externalId) {
        return idempotencyResolver.findId(getName(), owner, externalId).flatMap(this::load);
    }

    @Override
    public AggregateView<S> append(String aggregateId, @Nullable AggregateView<S> current, List<DomainEvent> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Nothing to append for " + getName() + " with id " + aggregateId);
        }
        if (events.stream().anyMatch(ErrorEvent.class::isInstance)) {
            throw new IllegalArgumentException("Error events are never appended to the log of " + getName());
        }
        long expectedGeneration = current != null ? current.generation() : 0L;
        List<DomainEventRecord> stored = eventStore.append(getName(), aggregateId, expectedGeneration, serialize(events));
        S state = fold(current != null ? current.state() : null, events);
        long generation = stored.get(stored.size() - 1).generation();
        logger.debug("Appended {} events to {} with id {}, generation {}", events.size(), getName(), aggregateId, generation);
        return new AggregateView<>(getName(), aggregateId, generation, state);
    }
}
