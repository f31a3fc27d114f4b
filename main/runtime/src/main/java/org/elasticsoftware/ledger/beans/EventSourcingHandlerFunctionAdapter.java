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
import org.elasticsoftware.ledger.aggregate.AggregateState;
import org.elasticsoftware.ledger.aggregate.DomainEventType;
import org.elasticsoftware.ledger.aggregate.EventSourcingHandlerFunction;
import org.elasticsoftware.ledger.events.DomainEvent;

import java.lang.reflect.Method;

/**
 * Binds an {@code @EventSourcingHandler} method. A fold step may not drop the state: a handler that
 * returns null is reported as a broken aggregate.
 */
public class EventSourcingHandlerFunctionAdapter<S extends AggregateState, E extends DomainEvent>
        implements EventSourcingHandlerFunction<S, E> {
    private final Aggregate<S> aggregate;
    private final HandlerMethod handlerMethod;
    private final Class<S> stateClass;
    private final DomainEventType<E> foldedType;

    public EventSourcingHandlerFunctionAdapter(Aggregate<S> aggregate,
                                               Method method,
                                               Class<S> stateClass,
                                               DomainEventType<E> foldedType) {
        this.aggregate = aggregate;
        this.handlerMethod = new HandlerMethod(aggregate, method);
        this.stateClass = stateClass;
        this.foldedType = foldedType;
    }

    @Override
    public S apply(E event, S state) {
        Object next = handlerMethod.invoke(event, state);
        if (next == null) {
            throw new IllegalStateException("Event sourcing handler " + handlerMethod.describe() +
                    " returned no state for " + foldedType.typeName() + " v" + foldedType.version());
        }
        return stateClass.cast(next);
    }

    @Override
    public DomainEventType<E> getEventType() {
        return foldedType;
    }

    @Override
    public Aggregate<S> getAggregate() {
        return aggregate;
    }

    @Override
    public boolean isCreate() {
        return foldedType.create();
    }
}
