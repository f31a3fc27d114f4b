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
import jakarta.validation.constraints.NotNull;

/**
 * An aggregate that embeds the state of another aggregate. Events of the embedded aggregate
 * reach the parent wrapped in a {@link org.elasticsoftware.ledger.events.SubAggregateEvent} and are
 * folded with the embedded aggregate's own handlers.
 *
 * @param <S> the state of the parent
 * @param <A> the state of the embedded aggregate
 */
public interface ParentAggregate<S extends AggregateState, A extends AggregateState> {
    @NotNull Aggregate<A> getSubAggregate();

    @Nullable A getSubAggregateState(@Nullable S state);

    /**
     * Returns a copy of {@code state} carrying the new embedded state. When {@code state} is null
     * (the embedded event was observed before the parent was created) an empty parent is returned.
     */
    @NotNull S withSubAggregateState(@NotNull String aggregateId, @Nullable S state, @NotNull A subAggregateState);
}
