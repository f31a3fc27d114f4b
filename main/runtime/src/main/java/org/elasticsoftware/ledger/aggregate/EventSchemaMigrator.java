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
import org.elasticsoftware.ledger.annotations.DomainEventInfo;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.SubAggregateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifts events of older schema versions to the version the aggregate's handlers expect by applying
 * the chain of upcasting handlers one version at a time.
 */
public class EventSchemaMigrator {
    private static final Logger logger = LoggerFactory.getLogger(EventSchemaMigrator.class);
    private final String aggregateName;
    private final Map<String, Integer> currentVersions;
    private final Map<Class<?>, UpcastingHandlerFunction<DomainEvent, DomainEvent>> upcastingHandlers;
    private final Map<String, Class<? extends DomainEvent>> eventClasses;
    @Nullable
    private final EventSchemaMigrator subAggregateMigrator;

    public EventSchemaMigrator(String aggregateName,
                               List<DomainEventType<?>> currentEventTypes,
                               List<UpcastingHandlerFunction<DomainEvent, DomainEvent>> upcastingHandlers,
                               @Nullable EventSchemaMigrator subAggregateMigrator) {
        this.aggregateName = aggregateName;
        this.subAggregateMigrator = subAggregateMigrator;
        Map<String, Integer> versions = new HashMap<>();
        Map<String, Class<? extends DomainEvent>> classes = new HashMap<>();
        for (DomainEventType<?> eventType : currentEventTypes) {
            versions.merge(eventType.typeName(), eventType.version(), Math::max);
            classes.put(key(eventType.typeName(), eventType.version()), eventType.typeClass());
        }
        Map<Class<?>, UpcastingHandlerFunction<DomainEvent, DomainEvent>> handlers = new HashMap<>();
        for (UpcastingHandlerFunction<DomainEvent, DomainEvent> handler : upcastingHandlers) {
            handlers.put(handler.getInputType().typeClass(), handler);
            classes.put(key(handler.getInputType().typeName(), handler.getInputType().version()), handler.getInputType().typeClass());
            classes.put(key(handler.getOutputType().typeName(), handler.getOutputType().version()), handler.getOutputType().typeClass());
        }
        this.currentVersions = Map.copyOf(versions);
        this.upcastingHandlers = Map.copyOf(handlers);
        this.eventClasses = Map.copyOf(classes);
    }

    /**
     * Returns the class that reads events of {@code typeName} written with {@code version}.
     */
    public Optional<Class<? extends DomainEvent>> resolveEventClass(String typeName, int version) {
        return Optional.ofNullable(eventClasses.get(key(typeName, version)));
    }

    public Optional<Integer> getCurrentVersion(String typeName) {
        return Optional.ofNullable(currentVersions.get(typeName));
    }

    @SuppressWarnings("unchecked")
    public DomainEvent migrate(DomainEvent event, MigrationContext migrationContext) {
        if (event instanceof SubAggregateEvent<?> subAggregateEvent && subAggregateMigrator != null) {
            DomainEvent embedded = subAggregateMigrator.migrate(subAggregateEvent.event(), migrationContext);
            return embedded == subAggregateEvent.event()
                    ? event
                    : ((SubAggregateEvent<DomainEvent>) subAggregateEvent).withEvent(embedded);
        }
        DomainEventInfo eventInfo = event.getClass().getAnnotation(DomainEventInfo.class);
        if (eventInfo == null) {
            throw new IllegalArgumentException("Event class " + event.getClass().getName() +
                    " must be annotated with @DomainEventInfo");
        }
        Integer currentVersion = currentVersions.get(eventInfo.type());
        if (currentVersion == null) {
            throw new MigrationGapException("Unknown event type " + eventInfo.type() + " for aggregate " + aggregateName,
                    aggregateName, event.getAggregateId(), eventInfo.type(), eventInfo.version());
        }
        if (eventInfo.version() > currentVersion) {
            throw new MigrationGapException("Event " + eventInfo.type() + " version " + eventInfo.version() +
                    " is newer than the current version " + currentVersion + " of aggregate " + aggregateName,
                    aggregateName, event.getAggregateId(), eventInfo.type(), eventInfo.version());
        }
        DomainEvent current = event;
        int version = eventInfo.version();
        while (version < currentVersion) {
            UpcastingHandlerFunction<DomainEvent, DomainEvent> handler = upcastingHandlers.get(current.getClass());
            if (handler == null) {
                throw new MigrationGapException("No upcasting handler for event " + eventInfo.type() + " version " + version +
                        " of aggregate " + aggregateName, aggregateName, event.getAggregateId(), eventInfo.type(), version);
            }
            current = handler.apply(current, migrationContext);
            logger.trace("Upcasted {} of {} with id {} from version {} to {}", eventInfo.type(), aggregateName,
                    event.getAggregateId(), version, handler.getOutputType().version());
            version = handler.getOutputType().version();
        }
        return current;
    }

    private static String key(String typeName, int version) {
        return typeName + "_v" + version;
    }
}
