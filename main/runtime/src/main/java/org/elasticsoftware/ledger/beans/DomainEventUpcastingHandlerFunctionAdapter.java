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
import org.elasticsoftware.ledger.aggregate.MigrationContext;
import org.elasticsoftware.ledger.aggregate.UpcastingHandlerFunction;
import org.elasticsoftware.ledger.events.DomainEvent;

import java.lang.reflect.Method;

/**
 * Binds an {@code @UpcastingHandler} method that lifts one schema version to the next. The method takes
 * the older event, optionally followed by the {@link MigrationContext} of the aggregate being loaded.
 */
public class DomainEventUpcastingHandlerFunctionAdapter<T extends DomainEvent, R extends DomainEvent>
        implements UpcastingHandlerFunction<T, R> {
    private final Aggregate<? extends AggregateState> aggregate;
    private final HandlerMethod handlerMethod;
    private final boolean needsContext;
    private final DomainEventType<T> fromType;
    private final DomainEventType<R> toType;

    public DomainEventUpcastingHandlerFunctionAdapter(Aggregate<? extends AggregateState> aggregate,
                                                      Method method,
                                                      DomainEventType<T> fromType,
                                                      DomainEventType<R> toType) {
        this.aggregate = aggregate;
        this.handlerMethod = new HandlerMethod(aggregate, method);
        this.needsContext = method.getParameterCount() == 2;
        this.fromType = fromType;
        this.toType = toType;
    }

    @Override
    public R apply(T event, MigrationContext migrationContext) {
        Object lifted = needsContext
                ? handlerMethod.invoke(event, migrationContext)
                : handlerMethod.invoke(event);
        if (lifted == null) {
            throw new IllegalStateException("Upcasting handler " + handlerMethod.describe() + " dropped " +
                    fromType.typeName() + " v" + fromType.version());
        }
        return toType.typeClass().cast(lifted);
    }

    @Override
    public DomainEventType<T> getInputType() {
        return fromType;
    }

    @Override
    public DomainEventType<R> getOutputType() {
        return toType;
    }

    @Override
    public Aggregate<? extends AggregateState> getAggregate() {
        return aggregate;
    }
}
