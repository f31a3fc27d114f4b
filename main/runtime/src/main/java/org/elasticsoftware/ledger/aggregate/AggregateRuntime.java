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
import java.util.Optional;

public interface AggregateRuntime<S extends AggregateState> extends AggregateRepository<S> {
    String getName();

    Class<? extends Aggregate<S>> getAggregateClass();

    boolean handles(Class<? extends Command> commandClass);

    boolean isCreateCommand(Class<? extends Command> commandClass);

    /**
     * Reads the event log of an aggregate, migrates every event to its current version and folds the
     * result. Empty when no event was ever appended for this id.
     *
     * @throws MigrationGapException when a stored event cannot be migrated
     */
    Optional<AggregateView<S>> load(String aggregateId);

    Optional<AggregateView<S>> findByExternalId(String owner, String externalId);

    /**
     * Runs the command handler for {@code command}. The result is either the events to append (possibly
     * none) or a single error event.
     */
    List<DomainEvent> handleCommand(Command command, @Nullable S state);

    /**
     * Appends {@code events} after {@code current} and returns the new view.
     *
     * @param current the view the events were produced from, null for a new aggregate
     */
    AggregateView<S> append(String aggregateId, @Nullable AggregateView<S> current, List<DomainEvent> events);

    List<DomainEventType<?>> getProducedDomainEventTypes();

    @Override
    default Optional<S> findById(String aggregateId) {
        return load(aggregateId).map(AggregateView::state);
    }
}
