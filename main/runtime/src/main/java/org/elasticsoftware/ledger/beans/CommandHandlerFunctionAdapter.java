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
import org.elasticsoftware.ledger.aggregate.CommandHandlerFunction;
import org.elasticsoftware.ledger.aggregate.CommandType;
import org.elasticsoftware.ledger.aggregate.DomainEventType;
import org.elasticsoftware.ledger.commands.Command;
import org.elasticsoftware.ledger.events.DomainEvent;
import org.elasticsoftware.ledger.events.ErrorEvent;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Binds a {@code @CommandHandler} method. Every event the method emits must be one of the types listed in
 * {@code produces}, or in {@code errors} when it is an {@link ErrorEvent}.
 */
public class CommandHandlerFunctionAdapter<S extends AggregateState, C extends Command>
        implements CommandHandlerFunction<S, C, DomainEvent> {
    private final Aggregate<S> aggregate;
    private final HandlerMethod handlerMethod;
    private final CommandType<C> commandType;
    private final List<DomainEventType<?>> outcomeTypes;
    private final List<DomainEventType<?>> rejectionTypes;
    private final Set<Class<?>> declaredClasses;

    public CommandHandlerFunctionAdapter(Aggregate<S> aggregate,
                                         Method method,
                                         CommandType<C> commandType,
                                         List<DomainEventType<?>> outcomeTypes,
                                         List<DomainEventType<?>> rejectionTypes) {
        this.aggregate = aggregate;
        this.handlerMethod = new HandlerMethod(aggregate, method);
        this.commandType = commandType;
        this.outcomeTypes = outcomeTypes;
        this.rejectionTypes = rejectionTypes;
        this.declaredClasses = Stream.concat(outcomeTypes.stream(), rejectionTypes.stream())
                .map(DomainEventType::typeClass)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Stream<DomainEvent> apply(C command, S state) {
        Object result = handlerMethod.invoke(command, state);
        if (result == null) {
            throw new IllegalStateException("Command handler " + handlerMethod.describe() + " returned null for " +
                    commandType.typeName());
        }
        return ((Stream<?>) result).map(this::checkDeclared);
    }

    private DomainEvent checkDeclared(Object emitted) {
        if (emitted instanceof DomainEvent event && declaredClasses.contains(event.getClass())) {
            return event;
        }
        throw new IllegalStateException("Command handler " + handlerMethod.describe() + " emitted undeclared " +
                (emitted == null ? "null" : emitted.getClass().getName()));
    }

    @Override
    public boolean isCreate() {
        return commandType.create();
    }

    @Override
    public CommandType<C> getCommandType() {
        return commandType;
    }

    @Override
    public Aggregate<S> getAggregate() {
        return aggregate;
    }

    @Override
    public List<DomainEventType<?>> getProducedDomainEventTypes() {
        return outcomeTypes;
    }

    @Override
    public List<DomainEventType<?>> getErrorEventTypes() {
        return rejectionTypes;
    }
}
