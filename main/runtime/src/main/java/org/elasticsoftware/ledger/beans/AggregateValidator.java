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

import org.elasticsoftware.ledger.aggregate.Aggregate;
import org.elasticsoftware.ledger.aggregate.CommandType;
import org.elasticsoftware.ledger.aggregate.DomainEventType;
import org.elasticsoftware.ledger.aggregate.MigrationGapException;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.SubAggregateEvent;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Checks the handlers detected on an aggregate before a runtime is built for it. Every problem
 * found here would otherwise surface as a runtime failure on some future command or replay.
 */
public class AggregateValidator {
    private final Class<? extends Aggregate<?>> aggregateClass;
    private final boolean subAggregate;
    private final Class<? extends DomainEvent> eventHierarchy;
    private final List<CommandType<?>> commandHandlers = new ArrayList<>();
    private final List<DomainEventType<?>> eventSourcingHandlers = new ArrayList<>();
    private final List<UpcastingHandler> upcastingHandlers = new ArrayList<>();
    private final Set<DomainEventType<?>> producedDomainEventTypes = new HashSet<>();

    public AggregateValidator(Class<? extends Aggregate<?>> aggregateClass,
                              Class<? extends DomainEvent> eventHierarchy,
                              boolean subAggregate) {
        this.aggregateClass = aggregateClass;
        this.eventHierarchy = eventHierarchy;
        this.subAggregate = subAggregate;
    }

    public void validate() {
        ensureCreateHandler();
        validateCommandHandlers();
        validateEventSourcingHandlers();
        validateUpcastingHandlers();
        ensureNoMigrationGaps();
        ensureExhaustiveEventHierarchy();
    }

    private void ensureCreateHandler() {
        long createHandlers = commandHandlers.stream().filter(CommandType::create).count();
        // embedded aggregates are created through their parent
        if (!subAggregate && createHandlers == 0) {
            throw new IllegalStateException("No create handler registered for aggregate " + aggregateClass.getName());
        }
        if (createHandlers > 1) {
            throw new IllegalStateException("Multiple command create handlers registered for aggregate " + aggregateClass.getName());
        }
    }

    private void validateCommandHandlers() {
        Set<String> seenCommandTypes = new HashSet<>();
        for (CommandType<?> commandType : commandHandlers) {
            String commandKey = commandType.typeName() + "_v" + commandType.version();
            if (!seenCommandTypes.add(commandKey)) {
                throw new IllegalStateException("Duplicate command handler for command " +
                        commandType.typeName() + " version " + commandType.version() +
                        " in aggregate " + aggregateClass.getName());
            }
        }
    }

    private void validateEventSourcingHandlers() {
        Set<String> seenEventTypes = new HashSet<>();
        for (DomainEventType<?> eventType : eventSourcingHandlers) {
            String eventKey = eventType.typeName() + "_v" + eventType.version();
            if (!seenEventTypes.add(eventKey)) {
                throw new IllegalStateException("Duplicate event sourcing handler for event " +
                        eventType.typeName() + " version " + eventType.version() +
                        " in aggregate " + aggregateClass.getName());
            }
        }

        if (eventSourcingHandlers.stream().filter(DomainEventType::create).count() != 1) {
            throw new IllegalStateException("Exactly one event sourcing handler for the create event is required in aggregate " +
                    aggregateClass.getName());
        }

        for (DomainEventType<?> producedEventType : producedDomainEventTypes) {
            if (producedEventType.error() || SubAggregateEvent.class.isAssignableFrom(producedEventType.typeClass())) {
                continue;
            }
            if (!hasEventSourcingHandler(producedEventType.typeName(), producedEventType.version())) {
                throw new IllegalStateException("No event sourcing handler for produced event " +
                        producedEventType.typeName() + " version " + producedEventType.version() +
                        " in aggregate " + aggregateClass.getName());
            }
        }
    }

    private void validateUpcastingHandlers() {
        Set<String> seenInputTypes = new HashSet<>();
        for (UpcastingHandler handler : upcastingHandlers) {
            DomainEventType<?> inputType = handler.inputType();
            DomainEventType<?> outputType = handler.outputType();

            if (!inputType.typeName().equals(outputType.typeName())) {
                throw new IllegalArgumentException("Input event type " + inputType.typeName() +
                        " does not match output event type " + outputType.typeName());
            }

            if (outputType.version() - inputType.version() != 1) {
                throw new IllegalArgumentException("Output event version " + outputType.version() +
                        " must be one greater than input event version " + inputType.version());
            }

            if (!seenInputTypes.add(inputType.typeName() + "_v" + inputType.version())) {
                throw new IllegalStateException("Duplicate upcasting handler for event " +
                        inputType.typeName() + " version " + inputType.version() +
                        " in aggregate " + aggregateClass.getName());
            }

            if (hasEventSourcingHandler(inputType.typeName(), inputType.version())) {
                throw new IllegalStateException("Event " + inputType.typeName() + " version " + inputType.version() +
                        " has both an event sourcing handler and an upcasting handler in aggregate " +
                        aggregateClass.getName());
            }
        }
    }

    private void ensureNoMigrationGaps() {
        Map<String, Integer> currentVersions = eventSourcingHandlers.stream()
                .collect(Collectors.toMap(DomainEventType::typeName, DomainEventType::version, Math::max));
        Map<String, Set<Integer>> upcastedVersions = upcastingHandlers.stream()
                .collect(Collectors.groupingBy(h -> h.inputType().typeName(),
                        Collectors.mapping(h -> h.inputType().version(), Collectors.toSet())));

        for (Map.Entry<String, Set<Integer>> entry : upcastedVersions.entrySet()) {
            String typeName = entry.getKey();
            Integer currentVersion = currentVersions.get(typeName);
            if (currentVersion == null) {
                throw new MigrationGapException("Event " + typeName + " is upcasted but has no event sourcing handler in aggregate " +
                        aggregateClass.getName(), aggregateClass.getSimpleName(), null, typeName, Collections.max(entry.getValue()) + 1);
            }
            int lowestVersion = Collections.min(entry.getValue());
            for (int version = lowestVersion; version < currentVersion; version++) {
                if (!entry.getValue().contains(version)) {
                    throw new MigrationGapException("Missing upcasting handler for event " + typeName + " version " + version +
                            " in aggregate " + aggregateClass.getName(), aggregateClass.getSimpleName(), null, typeName, version);
                }
            }
        }
    }

    private void ensureExhaustiveEventHierarchy() {
        if (eventHierarchy == DomainEvent.class) {
            return;
        }
        if (!eventHierarchy.isSealed()) {
            throw new IllegalStateException("Event hierarchy " + eventHierarchy.getName() + " of aggregate " +
                    aggregateClass.getName() + " must be a sealed type");
        }
        // legacy versions are handled by migrating them forward
        Set<Class<?>> handledClasses = new HashSet<>();
        eventSourcingHandlers.forEach(type -> handledClasses.add(type.typeClass()));
        upcastingHandlers.forEach(handler -> handledClasses.add(handler.inputType().typeClass()));
        for (Class<?> eventClass : permittedLeaves(eventHierarchy)) {
            if (!SubAggregateEvent.class.isAssignableFrom(eventClass) && !handledClasses.contains(eventClass)) {
                throw new IllegalStateException("No event sourcing handler for " + eventClass.getName() +
                        " in aggregate " + aggregateClass.getName());
            }
        }
    }

    private static List<Class<?>> permittedLeaves(Class<?> sealedType) {
        List<Class<?>> leaves = new ArrayList<>();
        for (Class<?> permitted : sealedType.getPermittedSubclasses()) {
            if (permitted.isSealed()) {
                leaves.addAll(permittedLeaves(permitted));
            } else {
                leaves.add(permitted);
            }
        }
        return leaves;
    }

    private boolean hasEventSourcingHandler(String typeName, int version) {
        return eventSourcingHandlers.stream().anyMatch(h -> h.typeName().equals(typeName) && h.version() == version);
    }

    public void detectCommandHandler(CommandType<?> commandType,
                                     List<DomainEventType<?>> producedDomainEventTypes) {
        commandHandlers.add(commandType);
        this.producedDomainEventTypes.addAll(producedDomainEventTypes);
    }

    public void detectEventSourcingHandler(DomainEventType<?> domainEventType) {
        eventSourcingHandlers.add(domainEventType);
    }

    public void detectUpcastingHandler(DomainEventType<?> inputEventType, DomainEventType<?> outputEventType) {
        upcastingHandlers.add(new UpcastingHandler(inputEventType, outputEventType));
    }

    private record UpcastingHandler(DomainEventType<?> inputType, DomainEventType<?> outputType) {
    }
}
