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

package org.elasticsoftware.ledger.beans;

import org.elasticsoftware.ledger.aggregate.*;
import org.elasticsoftware.ledger.annotations.*;
import org.elasticsoftware.ledger.commands.Command;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;
import org.elasticsoftware.ledger.events.SubAggregateEvent;
import org.elasticsoftware.ledger.idempotency.IdempotencyResolver;
import org.elasticsoftware.ledger.serialization.DomainEventSerde;
import org.elasticsoftware.ledger.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.*;
import java.util.stream.Stream;

/**
 * Builds an {@link AggregateRuntime} from the annotated handler methods of an aggregate. The
 * aggregate is validated before anything is built, a misconfigured aggregate never gets a runtime.
 */
public class AggregateRuntimeFactory {
    private static final Logger logger = LoggerFactory.getLogger(AggregateRuntimeFactory.class);
    private final EventStore eventStore;
    private final DomainEventSerde serde;
    private final MigrationContextProvider migrationContextProvider;
    private final IdempotencyResolver idempotencyResolver;

    public AggregateRuntimeFactory(EventStore eventStore,
                                   DomainEventSerde serde,
                                   MigrationContextProvider migrationContextProvider,
                                   IdempotencyResolver idempotencyResolver) {
        this.eventStore = eventStore;
        this.serde = serde;
        this.migrationContextProvider = migrationContextProvider;
        this.idempotencyResolver = idempotencyResolver;
    }

    public <S extends AggregateState> AggregateRuntime<S> create(Aggregate<S> aggregate) {
        AggregateDefinition<S> definition = scan(aggregate, false);
        logger.info("Created runtime for aggregate {} with {} command handlers", definition.name(), definition.commandHandlers().size());
        return new EventStoreAggregateRuntime<>(
                aggregate,
                definition.name(),
                definition.folder(),
                definition.migrator(),
                definition.commandHandlers(),
                serde,
                migrationContextProvider,
                eventStore,
                idempotencyResolver);
    }

    @SuppressWarnings("unchecked")
    private <S extends AggregateState> AggregateDefinition<S> scan(Aggregate<S> aggregate, boolean subAggregate) {
        final Class<? extends Aggregate<S>> aggregateClass = (Class<? extends Aggregate<S>>) aggregate.getClass();
        AggregateInfo aggregateInfo = aggregateClass.getAnnotation(AggregateInfo.class);
        if (aggregateInfo == null) {
            throw new IllegalStateException("Aggregate class " + aggregateClass.getName() + " must be annotated with @AggregateInfo");
        }
        Class<S> stateClass = aggregate.getStateClass();
        AggregateValidator validator = new AggregateValidator(aggregateClass, aggregateInfo.events(), subAggregate);

        Map<Class<?>, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers = new HashMap<>();
        List<DomainEventType<?>> currentEventTypes = new ArrayList<>();
        List<UpcastingHandlerFunction<DomainEvent, DomainEvent>> upcastingHandlers = new ArrayList<>();
        Map<Class<?>, CommandHandlerFunction<S, Command, DomainEvent>> commandHandlers = new HashMap<>();

        for (Method method : aggregateClass.getMethods()) {
            if (method.isAnnotationPresent(EventSourcingHandler.class)) {
                EventSourcingHandlerFunctionAdapter<S, DomainEvent> adapter = processEventSourcingHandler(aggregate, stateClass, method);
                eventSourcingHandlers.put(adapter.getEventType().typeClass(), adapter);
                currentEventTypes.add(adapter.getEventType());
                validator.detectEventSourcingHandler(adapter.getEventType());
            } else if (method.isAnnotationPresent(UpcastingHandler.class)) {
                DomainEventUpcastingHandlerFunctionAdapter<DomainEvent, DomainEvent> adapter = processUpcastingHandler(aggregate, method);
                upcastingHandlers.add(adapter);
                validator.detectUpcastingHandler(adapter.getInputType(), adapter.getOutputType());
            } else if (method.isAnnotationPresent(CommandHandler.class)) {
                CommandHandlerFunctionAdapter<S, Command> adapter = processCommandHandler(aggregate, stateClass, method);
                commandHandlers.put(adapter.getCommandType().typeClass(), adapter);
                validator.detectCommandHandler(adapter.getCommandType(), adapter.getProducedDomainEventTypes());
                // wrapper events are folded by the embedded aggregate, they are current as declared
                adapter.getProducedDomainEventTypes().stream()
                        .filter(type -> SubAggregateEvent.class.isAssignableFrom(type.typeClass()))
                        .filter(type -> !currentEventTypes.contains(type))
                        .forEach(currentEventTypes::add);
            }
        }
        validator.validate();

        AggregateFolder<S> folder = new AggregateFolder<>(aggregateInfo.value(), eventSourcingHandlers);
        EventSchemaMigrator subAggregateMigrator = null;
        if (aggregate instanceof ParentAggregate<?, ?> parentAggregate) {
            SubAggregateParts<S> parts = attachSubAggregate((ParentAggregate<S, ?>) parentAggregate, folder);
            folder = parts.folder();
            subAggregateMigrator = parts.migrator();
        }
        EventSchemaMigrator migrator = new EventSchemaMigrator(aggregateInfo.value(), currentEventTypes, upcastingHandlers, subAggregateMigrator);
        return new AggregateDefinition<>(aggregateInfo.value(), folder, migrator, commandHandlers);
    }

    private <S extends AggregateState, A extends AggregateState> SubAggregateParts<S> attachSubAggregate(ParentAggregate<S, A> parent,
                                                                                                        AggregateFolder<S> folder) {
        AggregateDefinition<A> subAggregate = scan(parent.getSubAggregate(), true);
        logger.debug("Embedding aggregate {}", subAggregate.name());
        return new SubAggregateParts<>(folder.withSubAggregate(parent, subAggregate.folder()), subAggregate.migrator());
    }

    @SuppressWarnings("unchecked")
    private <S extends AggregateState> EventSourcingHandlerFunctionAdapter<S, DomainEvent> processEventSourcingHandler(Aggregate<S> aggregate,
                                                                                                                      Class<S> stateClass,
                                                                                                                      Method method) {
        EventSourcingHandler eventSourcingHandler = method.getAnnotation(EventSourcingHandler.class);
        if (method.getParameterCount() == 2 &&
                DomainEvent.class.isAssignableFrom(method.getParameterTypes()[0]) &&
                stateClass.equals(method.getParameterTypes()[1]) &&
                stateClass.equals(method.getReturnType())) {
            Class<DomainEvent> domainEventClass = (Class<DomainEvent>) method.getParameterTypes()[0];
            DomainEventInfo eventInfo = requireEventInfo(domainEventClass);
            DomainEventType<DomainEvent> foldedType = new DomainEventType<>(eventInfo.type(), eventInfo.version(),
                    domainEventClass, eventSourcingHandler.create(), false);
            return new EventSourcingHandlerFunctionAdapter<>(aggregate, method, stateClass, foldedType);
        } else {
            throw new IllegalStateException("Invalid EventSourcingHandler method signature: " + method);
        }
    }

    @SuppressWarnings("unchecked")
    private DomainEventUpcastingHandlerFunctionAdapter<DomainEvent, DomainEvent> processUpcastingHandler(Aggregate<?> aggregate,
                                                                                                       Method method) {
        boolean contextAware = method.getParameterCount() == 2 && MigrationContext.class.equals(method.getParameterTypes()[1]);
        if ((method.getParameterCount() == 1 || contextAware) &&
                DomainEvent.class.isAssignableFrom(method.getParameterTypes()[0]) &&
                DomainEvent.class.isAssignableFrom(method.getReturnType())) {
            Class<DomainEvent> fromClass = (Class<DomainEvent>) method.getParameterTypes()[0];
            Class<DomainEvent> toClass = (Class<DomainEvent>) method.getReturnType();
            DomainEventInfo fromInfo = requireEventInfo(fromClass);
            DomainEventInfo toInfo = requireEventInfo(toClass);
            return new DomainEventUpcastingHandlerFunctionAdapter<>(
                    aggregate,
                    method,
                    new DomainEventType<>(fromInfo.type(), fromInfo.version(), fromClass, false, false),
                    new DomainEventType<>(toInfo.type(), toInfo.version(), toClass, false, false));
        } else {
            throw new IllegalStateException("Invalid UpcastingHandler method signature: " + method);
        }
    }

    @SuppressWarnings("unchecked")
    private <S extends AggregateState> CommandHandlerFunctionAdapter<S, Command> processCommandHandler(Aggregate<S> aggregate,
                                                                                                      Class<S> stateClass,
                                                                                                      Method method) {
        CommandHandler commandHandler = method.getAnnotation(CommandHandler.class);
        if (method.getParameterCount() == 2 &&
                Command.class.isAssignableFrom(method.getParameterTypes()[0]) &&
                stateClass.equals(method.getParameterTypes()[1]) &&
                Stream.class.equals(method.getReturnType())) {
            Class<Command> commandClass = (Class<Command>) method.getParameterTypes()[0];
            CommandInfo commandInfo = commandClass.getAnnotation(CommandInfo.class);
            if (commandInfo == null) {
                throw new IllegalStateException("Command class " + commandClass.getName() + " must be annotated with @CommandInfo");
            }
            CommandType<Command> commandType = new CommandType<>(commandInfo.type(), commandInfo.version(), commandClass, commandHandler.create());
            List<DomainEventType<?>> producedTypes = Arrays.stream(commandHandler.produces())
                    .map(AggregateRuntimeFactory::toDomainEventType)
                    .toList();
            List<DomainEventType<?>> errorTypes = Arrays.stream(commandHandler.errors())
                    .map(AggregateRuntimeFactory::toDomainEventType)
                    .toList();
            return new CommandHandlerFunctionAdapter<>(aggregate, method, commandType, producedTypes, errorTypes);
        } else {
            throw new IllegalStateException("Invalid CommandHandler method signature: " + method);
        }
    }

    private static DomainEventType<?> toDomainEventType(Class<? extends DomainEvent> eventClass) {
        DomainEventInfo eventInfo = requireEventInfo(eventClass);
        return new DomainEventType<>(eventInfo.type(), eventInfo.version(), eventClass, false, ErrorEvent.class.isAssignableFrom(eventClass));
    }

    private static DomainEventInfo requireEventInfo(Class<?> eventClass) {
        DomainEventInfo eventInfo = eventClass.getAnnotation(DomainEventInfo.class);
        if (eventInfo == null) {
            throw new IllegalStateException("Event class " + eventClass.getName() + " must be annotated with @DomainEventInfo");
        }
        return eventInfo;
    }

    private record AggregateDefinition<S extends AggregateState>(
            String name,
            AggregateFolder<S> folder,
            EventSchemaMigrator migrator,
            Map<Class<?>, CommandHandlerFunction<S, Command, DomainEvent>> commandHandlers) {
    }

    private record SubAggregateParts<S extends AggregateState>(AggregateFolder<S> folder, EventSchemaMigrator migrator) {
    }
}
