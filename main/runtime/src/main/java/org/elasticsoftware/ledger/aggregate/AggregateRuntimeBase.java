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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import jakarta.annotation.Nullable;
import org.elasticsoftware.ledger.commands.Command;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.events.SubAggregateEvent;
import org.elasticsoftware.ledger.protocol.DomainEventRecord;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public abstract class AggregateRuntimeBase<S extends AggregateState> implements AggregateRuntime<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRuntimeBase.class);
    private final Aggregate<S> aggregate;
    private final String name;
    private final AggregateFolder<S> folder;
    private final EventSchemaMigrator migrator;
    private final Map<Class<?>, CommandHandlerFunction<S, Command, DomainEvent>> commandHandlers;
    private final DomainEventSerde serde;
    private final MigrationContextProvider migrationContextProvider;

    protected AggregateRuntimeBase(Aggregate<S> aggregate,
                                   String name,
                                   AggregateFolder<S> folder,
                                   EventSchemaMigrator migrator,
                                   Map<Class<?>, CommandHandlerFunction<S, Command, DomainEvent>> commandHandlers,
                                   DomainEventSerde serde,
                                   MigrationContextProvider migrationContextProvider) {
        this.aggregate = aggregate;
        this.name = name;
        this.folder = folder;
        this.migrator = migrator;
        this.commandHandlers = Map.copyOf(commandHandlers);
        this.serde = serde;
        this.migrationContextProvider = migrationContextProvider;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<? extends Aggregate<S>> getAggregateClass() {
        return (Class<? extends Aggregate<S>>) aggregate.getClass();
    }

    @Override
    public boolean handles(Class<? extends Command> commandClass) {
        return commandHandlers.containsKey(commandClass);
    }

    @Override
    public boolean isCreateCommand(Class<? extends Command> commandClass) {
        CommandHandlerFunction<S, Command, DomainEvent> handler = commandHandlers.get(commandClass);
        return handler != null && handler.isCreate();
    }

    @Override
    public List<DomainEventType<?>> getProducedDomainEventTypes() {
        return commandHandlers.values().stream()
                .flatMap(handler -> handler.getProducedDomainEventTypes().stream())
                .distinct()
                .toList();
    }

    @Override
    public List<DomainEvent> handleCommand(Command command, @Nullable S state) {
        CommandHandlerFunction<S, Command, DomainEvent> handler = commandHandlers.get(command.getClass());
        if (handler == null) {
            throw new IllegalArgumentException("No command handler for " + command.getClass().getName() + " in aggregate " + name);
        }
        if (state == null && !handler.isCreate()) {
            throw new IllegalArgumentException("Command " + handler.getCommandType().typeName() + " requires an existing " + name);
        }
        List<DomainEvent> events = handler.apply(command, state).toList();
        Optional<DomainEvent> error = events.stream().filter(ErrorEvent.class::isInstance).findFirst();
        if (error.isPresent()) {
            logger.debug("Command {} for {} with id {} produced {}", handler.getCommandType().typeName(), name,
                    command.getAggregateId(), error.get().getClass().getSimpleName());
            return List.of(error.get());
        }
        return events;
    }

    /**
     * Migrates and folds stored records. Returns null when {@code records} is empty.
     */
    @Nullable
    protected AggregateView<S> materialize(String aggregateId, List<DomainEventRecord> records) {
        if (records.isEmpty()) {
            return null;
        }
        // only legacy events need the context, so it is fetched at most once and only when asked for
        Supplier<MigrationContext> migrationContext =
                Suppliers.memoize(() -> migrationContextProvider.getMigrationContext(name, aggregateId));
        S state = null;
        for (DomainEventRecord record : records) {
            Class<? extends DomainEvent> eventClass = migrator.resolveEventClass(record.name(), record.version())
                    .orElseThrow(() -> new MigrationGapException("No event class for " + record.name() + " version " +
                            record.version() + " in aggregate " + name, name, aggregateId, record.name(), record.version()));
            DomainEvent event = serde.deserialize(name, record, eventClass);
            boolean current = !SubAggregateEvent.class.isAssignableFrom(eventClass) &&
                    migrator.getCurrentVersion(record.name()).map(v -> v == record.version()).orElse(false);
            DomainEvent migrated = current
                    ? migrator.migrate(event, MigrationContext.empty())
                    : migrator.migrate(event, migrationContext.get().withTimestamp(record.timestamp()));
            state = folder.apply(migrated, state);
        }
        return new AggregateView<>(name, aggregateId, records.get(records.size() - 1).generation(), state);
    }

    protected List<DomainEventRecord> serialize(List<DomainEvent> events) {
        return events.stream().map(event -> serde.serialize(name, event)).toList();
    }

    protected S fold(@Nullable S state, List<DomainEvent> events) {
        return folder.fold(state, events);
    }

    protected EventSchemaMigrator getMigrator() {
        return migrator;
    }
}
