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

package org.elasticsoftware.ledger.commands;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.ledger.aggregate.AggregateState;

/**
 * A command that creates a new aggregate. The aggregate id is not known to the client, it is
 * assigned by the idempotency resolver before the command reaches its handler.
 *
 * @param <S> the state of the aggregate this command creates
 * @param <C> the command type itself
 */
public interface CreateAggregateCommand<S extends AggregateState, C extends CreateAggregateCommand<S, C>> extends Command {
    /**
     * The client supplied deduplication key, or null when the client did not send one.
     */
    @Nullable String externalId();

    /**
     * Returns a copy of this command bound to the resolved aggregate id and owning party.
     */
    @NotNull C assign(@NotNull String aggregateId, @NotNull String partyId);

    /**
     * Compares the fields that define the entity with an aggregate that already exists under the
     * same external id. Optional fields are not part of the comparison.
     */
    boolean matches(@NotNull S existingState);
}
