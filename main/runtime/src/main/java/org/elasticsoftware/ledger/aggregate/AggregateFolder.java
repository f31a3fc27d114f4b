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
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.SubAggregateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Replays migrated events into the state of one aggregate. Events of an embedded aggregate are
 * folded by the embedded aggregate's own folder and stored back into the parent state.
 */
public class AggregateFolder<S extends AggregateState> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateFolder.class);
    private final String aggregateName;
    private final Map<Class<?>, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers;
    @Nullable
    private final SubAggregateDelegate<S, ?> subAggregateDelegate;

    public AggregateFolder(String aggregateName,
                           Map<Class<?>, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers) {
        this(aggregateName, eventSourcingHandlers, null);
    }

    private AggregateFolder(String aggregateName,
                            Map<Class<?>, EventSourcingHandlerFunction<S, DomainEvent>> eventSourcingHandlers,
                            @Nullable SubAggregateDelegate<S, ?> subAggregateDelegate) {
        this.aggregateName = aggregateName;
        this.eventSourcingHandlers = Map.copyOf(eventSourcingHandlers);
        this.subAggregateDelegate = subAggregateDelegate;
    }

    public <A extends AggregateState> AggregateFolder<S> withSubAggregate(ParentAggregate<S, A> parent,
                                                                          AggregateFolder<A> subAggregateFolder) {
        return new AggregateFolder<>(aggregateName, eventSourcingHandlers, new SubAggregateDelegate<>(parent, subAggregateFolder));
    }

    public S apply(DomainEvent event, @Nullable S state) {
        if (event instanceof SubAggregateEvent<?> subAggregateEvent) {
            if (subAggregateDelegate == null) {
                throw new IllegalStateException("Aggregate " + aggregateName + " does not embed an aggregate for " +
                        event.getClass().getName());
            }
            return subAggregateDelegate.apply(event.getAggregateId(), subAggregateEvent, state);
        }
        EventSourcingHandlerFunction<S, DomainEvent> handler = eventSourcingHandlers.get(event.getClass());
        if (handler == null) {
            throw new IllegalStateException("No event sourcing handler for " + event.getClass().getName() +
                    " in aggregate " + aggregateName);
        }
        if (state == null && !handler.isCreate()) {
            throw new IllegalStateException("Event " + event.getClass().getSimpleName() + " applied before " +
                    aggregateName + " with id " + event.getAggregateId() + " was created");
        }
        logger.trace("Applying {} to {} with id {}", event.getClass().getSimpleName(), aggregateName, event.getAggregateId());
        return handler.apply(event, state);
    }

    /**
     * Left fold over {@code events}, starting from {@code state}. Returns null only when
     * {@code events} is empty and {@code state} is null.
     */
    @Nullable
    public S fold(@Nullable S state, List<? extends DomainEvent> events) {
        S current = state;
        for (DomainEvent event : events) {
            current = apply(event, current);
        }
        return current;
    }

    private record SubAggregateDelegate<S extends AggregateState, A extends AggregateState>(
            ParentAggregate<S, A> parent,
            AggregateFolder<A> folder) {
        S apply(String aggregateId, SubAggregateEvent<?> subAggregateEvent, @Nullable S state) {
            A subAggregateState = parent.getSubAggregateState(state);
            A updated = folder.apply(subAggregateEvent.event(), subAggregateState);
            return parent.withSubAggregateState(aggregateId, state, updated);
        }
    }
}
