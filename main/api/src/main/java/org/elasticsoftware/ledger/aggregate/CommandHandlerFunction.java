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

import java.util.List;
import java.util.stream.Stream;

/**
 * Decides a command against the current state of an aggregate.
 *
 * @param <S> the aggregate state
 * @param <C> the handled command
 * @param <E> the emitted events
 */
public interface CommandHandlerFunction<S extends AggregateState, C extends Command, E extends DomainEvent> {
    /**
     * @param state null when the command creates the aggregate
     * @return the resulting events, empty when the command changes nothing
     */
    Stream<E> apply(C command, @Nullable S state);

    /**
     * True when the command may only run against an aggregate that does not exist yet.
     */
    boolean isCreate();

    CommandType<C> getCommandType();

    Aggregate<S> getAggregate();

    List<DomainEventType<?>> getProducedDomainEventTypes();

    List<DomainEventType<?>> getErrorEventTypes();
}
